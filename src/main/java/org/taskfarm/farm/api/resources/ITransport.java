package org.taskfarm.farm.api.resources;

import java.io.IOException;
import java.util.List;

/**
 * An explicitly constructed message channel handle shared by one dispatcher and a fixed
 * set of workers.
 * <p>
 * A transport always exposes the dispatcher side. Workers that run inside this JVM get
 * their channels from {@link #localWorkerChannels()}; for a transport whose workers are
 * remote processes that list is empty.
 */
public interface ITransport extends AutoCloseable {

    /**
     * @return the dispatcher's channel.
     */
    IDispatcherChannel dispatcherChannel();

    /**
     * @return channels for workers hosted in this JVM, one per worker, ordered by worker id.
     */
    List<IWorkerChannel> localWorkerChannels();

    /**
     * Releases all transport resources (threads, sockets).
     */
    @Override
    void close() throws IOException;
}
