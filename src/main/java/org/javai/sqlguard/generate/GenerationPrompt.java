package org.javai.sqlguard.generate;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.sqlguard.grammar.GrammarPromptGenerator;

/**
 * Prompt text shared by the generation clients, plus clean-up of what comes back.
 */
public final class GenerationPrompt {

	/**
	 * Reply that signals the service declines the question.
	 */
	public static final String REFUSE_TOKEN = "REFUSE";

	private static final Pattern CODE_FENCE = Pattern.compile("```(?:sql)?\\s*\\n?(.*?)\\s*```", Pattern.DOTALL);

	private GenerationPrompt() {
	}

	public static String toolDescription(GenerationRequest request) {
		return new GrammarPromptGenerator().generate(request.artifact());
	}

	/**
	 * System prompt for services that cannot enforce the grammar themselves.
	 */
	public static String systemPrompt(GenerationRequest request) {
		return toolDescription(request) + "\n\n"
				+ "GRAMMAR (Lark):\n" + request.artifact().toLark() + "\n"
				+ """
				OUTPUT RULES:
				- Reply with the query only, on one line, ending with ;
				- No markdown, no explanations, no comments.
				- Use table and column names exactly as written above.
				- If the question needs anything the grammar does not allow, reply with REFUSE.
				""";
	}

	public static String userPrompt(GenerationRequest request) {
		StringBuilder sb = new StringBuilder();
		sb.append("SCHEMA:\n").append(request.schemaContext()).append('\n');
		sb.append("USER QUESTION: ").append(request.question());
		if (request.hasFeedback()) {
			sb.append("\n\nYour previous query was rejected: ").append(request.feedback())
					.append("\nProduce a corrected query.");
		}
		return sb.toString();
	}

	/**
	 * Strip code fences and surrounding whitespace; map the refusal token to a refusal.
	 */
	public static GenerationResponse interpret(String content) {
		if (content == null || content.isBlank()) {
			throw new GenerationException("Generation service returned an empty response");
		}
		String text = content.trim();
		Matcher matcher = CODE_FENCE.matcher(text);
		if (matcher.find()) {
			text = matcher.group(1).trim();
		}
		if (text.toUpperCase(Locale.ROOT).startsWith(REFUSE_TOKEN)) {
			String reason = text.substring(REFUSE_TOKEN.length()).replaceFirst("^[\\s:.-]+", "").trim();
			return new GenerationResponse.Refusal(reason);
		}
		return new GenerationResponse.Candidate(text);
	}
}
