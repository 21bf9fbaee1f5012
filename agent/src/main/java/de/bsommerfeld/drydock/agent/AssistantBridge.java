package de.bsommerfeld.drydock.agent;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.config.AssistantConfig;
import de.bsommerfeld.drydock.core.config.DryDockConfig;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking facade over a local Ollama server.
 *
 * <h3>Call model</h3>
 * Chat goes through a langchain4j {@link OllamaChatModel}. Each
 * {@link #send} runs the model call on its own single-thread executor, waits
 * for it with a bounded timeout and then discards the executor. Callers are
 * expected to invoke this off the render thread.
 *
 * <h3>Liveness</h3>
 * {@link #isServerAvailable()} issues a plain {@code GET /api/tags}.
 */
@Singleton
public class AssistantBridge {

    private static final Logger LOG = LoggerFactory.getLogger(AssistantBridge.class);

    private final ChatLanguageModel chatModel;
    private final URI tagsEndpoint;
    private final String model;
    private final Duration timeout;
    private final Duration statusTimeout;
    private final HttpClient httpClient;

    @Inject
    public AssistantBridge(DryDockConfig config) {
        this(config.getAssistant());
    }

    AssistantBridge(AssistantConfig config) {
        this(config.getBaseUrl(), config.getModel(),
                Duration.ofSeconds(config.getTimeoutSeconds()),
                Duration.ofSeconds(config.getStatusTimeoutSeconds()));
    }

    public AssistantBridge(String baseUrl, String model, Duration timeout, Duration statusTimeout) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tagsEndpoint = URI.create(base + "/api/tags");
        this.model = model;
        this.timeout = timeout;
        this.statusTimeout = statusTimeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(statusTimeout).build();
        // One attempt per call, the caller decides whether to ask again
        this.chatModel = OllamaChatModel.builder()
                .baseUrl(base)
                .modelName(model)
                .timeout(timeout)
                .maxRetries(1)
                .build();
    }

    /**
     * Sends the conversation and returns the assistant's reply.
     *
     * @throws AssistantException if {@code messages} is empty, the server is
     *                            unreachable or rejects the request, the call
     *                            exceeds the timeout, or the reply carries no
     *                            text
     */
    public String send(List<ChatMessage> messages) throws AssistantException {
        if (messages == null || messages.isEmpty())
            throw new AssistantException("No messages provided");

        List<dev.langchain4j.data.message.ChatMessage> conversation = toConversation(messages);
        LOG.info("Sending chat request to Ollama ({} messages, model {})", messages.size(), model);

        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "assistant-bridge");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<Response<AiMessage>> call = executor.submit(() -> chatModel.generate(conversation));
            AiMessage reply = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS).content();
            if (reply == null || reply.text() == null)
                throw new AssistantException("Ollama returned no message content");
            LOG.info("Received response from Ollama");
            return reply.text();
        } catch (TimeoutException e) {
            throw new AssistantException("Ollama did not answer within " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Ollama chat request failed: {}", cause.getMessage());
            throw new AssistantException("Ollama API error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssistantException("Interrupted while waiting for Ollama", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /** {@code true} if the server answers the liveness check with 2xx in time. */
    public boolean isServerAvailable() {
        HttpRequest request = HttpRequest.newBuilder(tagsEndpoint).timeout(statusTimeout).GET().build();
        try {
            int status = httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
            return status >= 200 && status < 300;
        } catch (IOException e) {
            LOG.debug("Ollama not reachable at {}: {}", tagsEndpoint, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static List<dev.langchain4j.data.message.ChatMessage> toConversation(List<ChatMessage> messages) {
        List<dev.langchain4j.data.message.ChatMessage> conversation = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            conversation.add(message.role() == ChatMessage.Role.USER
                    ? UserMessage.from(message.content())
                    : AiMessage.from(message.content()));
        }
        return conversation;
    }
}
