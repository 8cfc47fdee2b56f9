package org.javai.sqlguard.generate;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link GenerationService} over a Spring AI {@link ChatClient}.
 * <p>
 * Chat models cannot enforce a grammar, so the Lark grammar travels in the system prompt
 * and the compiler's validator does the enforcing.
 */
public class ChatClientGenerationService implements GenerationService {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientGenerationService.class);

	private final ChatClient chatClient;

	public ChatClientGenerationService(ChatClient chatClient) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
	}

	@Override
	public GenerationResponse generate(GenerationRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		String system = GenerationPrompt.systemPrompt(request);
		String user = GenerationPrompt.userPrompt(request);
		logger.debug("Attempt {} system prompt:\n{}", request.attempt(), system);
		logger.debug("Attempt {} user prompt:\n{}", request.attempt(), user);

		String content;
		try {
			content = chatClient.prompt()
					.system(system)
					.user(user)
					.call()
					.content();
		}
		catch (RuntimeException e) {
			throw new GenerationException("Chat model call failed: " + e.getMessage(), e);
		}
		logger.debug("Attempt {} model response:\n{}", request.attempt(), content);
		return GenerationPrompt.interpret(content);
	}
}
