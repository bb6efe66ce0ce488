package com.auraflux.core.agent;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Owns the single {@link ChatClient} used by every worker.
 * <p>
 * The client is built on first use and shared by all worker threads. {@link #close()} releases it
 * at shutdown; later calls to {@link #get()} fail.
 */
@Component
public class GenerationClientHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GenerationClientHandle.class);

    private final Supplier<ChatClient> factory;
    private final Object lock = new Object();
    private volatile ChatClient client;
    private volatile boolean closed;

    @Autowired
    public GenerationClientHandle(ObjectProvider<ChatClient.Builder> builderProvider,
                                  @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(() -> {
            log.info("Building generation client (OpenAI base-url: {})", baseUrl);
            return builderProvider.getObject().build();
        });
    }

    GenerationClientHandle(Supplier<ChatClient> factory) {
        this.factory = factory;
    }

    /**
     * @throws IllegalStateException after {@link #close()}
     */
    public ChatClient get() {
        ChatClient current = client;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Generation client has been closed");
            }
            if (client == null) {
                client = factory.get();
            }
            return client;
        }
    }

    public boolean isInitialized() {
        return client != null;
    }

    @PreDestroy
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (client != null) {
                log.info("Releasing generation client");
            }
            client = null;
        }
    }
}
