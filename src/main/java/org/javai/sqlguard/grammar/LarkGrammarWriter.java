package org.javai.sqlguard.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link GrammarArtifact} as Lark grammar text.
 * <p>
 * Output is a pure function of the artifact: productions in declaration order, pattern
 * terminals in order of first use. Productions with an empty alternative render as an
 * optional group. Nothing is {@code %ignore}d: whitespace is matched only where the
 * productions place the {@code _WS} terminal, exactly as the validator matches it.
 */
public class LarkGrammarWriter {

	public String write(GrammarArtifact artifact) {
		StringBuilder sb = new StringBuilder();
		sb.append("// Read-only queries over ").append(artifact.schema().table()).append('\n');
		sb.append("// Generated from the schema registry; do not edit.\n\n");

		Map<String, Terminal> patterns = new LinkedHashMap<>();
		for (Production production : artifact.productions()) {
			sb.append(production.name()).append(": ");
			sb.append(renderAlternatives(production, patterns));
			sb.append('\n');
		}

		if (!patterns.isEmpty()) {
			sb.append('\n');
			for (Terminal terminal : patterns.values()) {
				sb.append(terminal.name()).append(": /").append(terminal.regex()).append("/\n");
			}
		}

		return sb.toString();
	}

	private String renderAlternatives(Production production, Map<String, Terminal> patterns) {
		List<String> rendered = new ArrayList<>();
		for (Alternative alternative : production.alternatives()) {
			if (!alternative.isEmpty()) {
				rendered.add(renderSequence(alternative, patterns));
			}
		}
		String body = String.join(" | ", rendered);
		if (!production.hasEmptyAlternative()) {
			return body;
		}
		if (rendered.size() == 1 && production.alternatives().size() == 2 && rendered.get(0).indexOf(' ') < 0) {
			return body + "?";
		}
		return "(" + body + ")?";
	}

	private String renderSequence(Alternative alternative, Map<String, Terminal> patterns) {
		List<String> parts = new ArrayList<>();
		for (GrammarSymbol symbol : alternative.symbols()) {
			if (symbol instanceof Terminal terminal) {
				if (terminal.isPattern()) {
					patterns.putIfAbsent(terminal.name(), terminal);
					parts.add(terminal.name());
				}
				else {
					parts.add(quote(terminal.display()));
				}
			}
			else {
				parts.add(symbol.name());
			}
		}
		return String.join(" ", parts);
	}

	private static String quote(String text) {
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
