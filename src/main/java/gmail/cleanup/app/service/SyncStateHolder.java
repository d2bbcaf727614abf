package gmail.cleanup.app.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single process-wide {@link SyncState}. A new run swaps in a fresh instance;
 * the previous one stays readable until then.
 */
@Component
public class SyncStateHolder {
    private final AtomicReference<SyncState> current = new AtomicReference<>(SyncState.idle());

    public SyncState current() {
        return current.get();
    }

    void replace(SyncState state) {
        current.set(state);
    }
}
