package org.javai.sqlguard.testsupport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;
import org.javai.sqlguard.generate.GenerationException;
import org.javai.sqlguard.generate.GenerationRequest;
import org.javai.sqlguard.generate.GenerationResponse;
import org.javai.sqlguard.generate.GenerationService;

/**
 * Test-only {@link GenerationService} that replays scripted responses per question without
 * calling a model. Responses for a question are consumed in order; the last one repeats.
 * Questions without a script get the fallback, a refusal unless configured otherwise.
 * Every request is recorded for assertions.
 */
public final class ScriptedGenerationService implements GenerationService {

	private final Map<String, Deque<Supplier<GenerationResponse>>> scripts = new ConcurrentHashMap<>();
	private final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();
	private volatile Function<GenerationRequest, GenerationResponse> fallback =
			request -> new GenerationResponse.Refusal("No scripted response for '" + request.question() + "'");
	private volatile Duration delay = Duration.ZERO;

	public ScriptedGenerationService candidates(String question, String... candidates) {
		for (String candidate : candidates) {
			script(question, () -> new GenerationResponse.Candidate(candidate));
		}
		return this;
	}

	public ScriptedGenerationService refusal(String question, String reason) {
		return script(question, () -> new GenerationResponse.Refusal(reason));
	}

	public ScriptedGenerationService failure(String question, RuntimeException failure) {
		return script(question, () -> {
			throw failure;
		});
	}

	public ScriptedGenerationService script(String question, Supplier<GenerationResponse> response) {
		Objects.requireNonNull(response, "response must not be null");
		scripts.computeIfAbsent(question, ignored -> new ArrayDeque<>()).add(response);
		return this;
	}

	public ScriptedGenerationService fallback(Function<GenerationRequest, GenerationResponse> fallback) {
		this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
		return this;
	}

	/**
	 * Makes every call sleep before answering, to exercise timeouts.
	 */
	public ScriptedGenerationService delay(Duration delay) {
		this.delay = delay;
		return this;
	}

	@Override
	public GenerationResponse generate(GenerationRequest request) {
		requests.add(request);
		if (!delay.isZero()) {
			try {
				Thread.sleep(delay.toMillis());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new GenerationException("Interrupted while generating", e);
			}
		}
		Deque<Supplier<GenerationResponse>> script = scripts.get(request.question());
		if (script == null) {
			return fallback.apply(request);
		}
		Supplier<GenerationResponse> next;
		synchronized (script) {
			next = script.size() > 1 ? script.poll() : script.peek();
		}
		return next.get();
	}

	public List<GenerationRequest> requests() {
		return List.copyOf(requests);
	}

	public int invocations() {
		return requests.size();
	}

	public int invocationsFor(String question) {
		return (int) requests.stream().filter(r -> r.question().equals(question)).count();
	}
}
