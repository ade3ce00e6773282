package dk.cloudcreate.cqrskit.command.cache;

import dk.cloudcreate.cqrskit.command.SourcingMode;
import dk.cloudcreate.cqrskit.types.Subject;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Identifies a rebuilt instance: the same subject rebuilt into different instance classes, or with different
 * {@link SourcingMode}'s, are cached separately
 */
public final class CacheKey {
    public final Subject      subject;
    public final Class<?>     instanceClass;
    public final SourcingMode sourcingMode;

    public CacheKey(Subject subject, Class<?> instanceClass, SourcingMode sourcingMode) {
        this.subject = requireNonNull(subject, "No subject provided");
        this.instanceClass = requireNonNull(instanceClass, "No instanceClass provided");
        this.sourcingMode = requireNonNull(sourcingMode, "No sourcingMode provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        var cacheKey = (CacheKey) o;
        return subject.equals(cacheKey.subject) && instanceClass.equals(cacheKey.instanceClass) && sourcingMode == cacheKey.sourcingMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, instanceClass, sourcingMode);
    }

    @Override
    public String toString() {
        return "CacheKey{" +
                "subject=" + subject +
                ", instanceClass=" + instanceClass.getSimpleName() +
                ", sourcingMode=" + sourcingMode +
                '}';
    }
}
