package org.javai.sqlguard.eval;

import java.util.Locale;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces SQL text to a canonical form so that equivalent spellings compare equal.
 */
final class SqlShapeNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(SqlShapeNormalizer.class);

	private SqlShapeNormalizer() {
	}

	static String normalize(String sql) {
		if (sql == null) {
			return "";
		}
		String body = stripTerminator(sql.strip());
		try {
			Statement statement = CCJSqlParserUtil.parse(body);
			return collapse(statement.toString());
		}
		catch (JSQLParserException e) {
			logger.debug("Falling back to textual normalization for '{}': {}", body, e.getMessage());
			return collapse(body);
		}
	}

	static boolean equivalent(String left, String right) {
		return normalize(left).equals(normalize(right));
	}

	private static String stripTerminator(String sql) {
		String result = sql;
		while (result.endsWith(";")) {
			result = result.substring(0, result.length() - 1).strip();
		}
		return result;
	}

	private static String collapse(String sql) {
		return sql.replaceAll("\\s+", " ")
				.replaceAll("\\s*([(),])\\s*", "$1")
				.strip()
				.toLowerCase(Locale.ROOT);
	}
}
