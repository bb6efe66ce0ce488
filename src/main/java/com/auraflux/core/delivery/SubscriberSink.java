package com.auraflux.core.delivery;

import java.io.IOException;

/**
 * Transport behind one subscriber connection (an SSE emitter, a test collector...).
 * An {@link IOException} means the connection is gone; the subscriber is then dropped.
 */
@FunctionalInterface
public interface SubscriberSink {

    void deliver(PushMessage message) throws IOException;
}
