package com.ryuqq.router.adapter.inmemory.registry;

import com.ryuqq.router.core.handler.Handler;
import com.ryuqq.router.core.spi.HandlerRegistry;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link HandlerRegistry} SPI.
 *
 * <p>This is the registry every Router uses unless another one is supplied. Bindings are held
 * in a {@link ConcurrentHashMap}, so registration may safely overlap with dispatch even though
 * the usual setup finishes registration before traffic begins.</p>
 *
 * <p><strong>Binding Rules:</strong></p>
 * <ul>
 *   <li>Exact-match keys: case-sensitive, untrimmed, empty string allowed</li>
 *   <li>Last write wins: re-registering a name silently replaces the previous handler</li>
 *   <li>At most one handler per name at any time</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>register:</strong> O(1) - ConcurrentHashMap put</li>
 *   <li><strong>lookup:</strong> O(1) - ConcurrentHashMap get, lock-free read</li>
 *   <li><strong>procedures:</strong> O(N) - snapshot copy</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * HandlerRegistry registry = new InMemoryHandlerRegistry();
 * registry.register("CreateOrder", new CreateOrderHandler());
 * registry.register("CreateOrder", new CreateOrderHandlerV2()); // replaces the first
 *
 * Optional&lt;Handler&gt; handler = registry.lookup("CreateOrder");
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class InMemoryHandlerRegistry implements HandlerRegistry {

    private final Map<String, Handler> handlers = new ConcurrentHashMap<>();

    /**
     * {@inheritDoc}
     *
     * @param procedure the procedure name
     * @param handler the handler to bind
     * @throws IllegalArgumentException if procedure or handler is null
     */
    @Override
    public void register(String procedure, Handler handler) {
        if (procedure == null) {
            throw new IllegalArgumentException("procedure cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        handlers.put(procedure, handler);
    }

    /**
     * {@inheritDoc}
     *
     * @param procedure the procedure name
     * @return the bound handler, or empty
     * @throws IllegalArgumentException if procedure is null
     */
    @Override
    public Optional<Handler> lookup(String procedure) {
        if (procedure == null) {
            throw new IllegalArgumentException("procedure cannot be null");
        }

        return Optional.ofNullable(handlers.get(procedure));
    }

    @Override
    public Set<String> procedures() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Removes all bindings.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        handlers.clear();
    }

    /**
     * Returns the number of bound procedures.
     *
     * @return the number of bindings
     */
    public int size() {
        return handlers.size();
    }
}
