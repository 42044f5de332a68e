package tech.yump.secretsync.sync;

import org.springframework.lang.Nullable;
import tech.yump.secretsync.cluster.ObjectKey;

import java.util.Map;
import java.util.Set;

/**
 * Output of one successful sync pass.
 *
 * @param target cluster secret to write {@code data} into; {@code null} when the definition pulls nothing
 * @param data   pulled key/value data
 * @param pushed remote secrets the pass wrote or confirmed
 */
public record SyncResult(ObjectKey key, @Nullable ObjectKey target, Map<String, byte[]> data, Set<PushedRef> pushed) {

    public SyncResult {
        data = Map.copyOf(data);
        pushed = Set.copyOf(pushed);
    }

    public boolean hasTarget() {
        return target != null;
    }
}
