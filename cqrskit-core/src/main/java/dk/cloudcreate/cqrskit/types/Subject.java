package dk.cloudcreate.cqrskit.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Hierarchical, slash separated, path that identifies the entity an event belongs to, e.g. <code>/task/42</code>.<br>
 * A subject contains itself and all its descendants, e.g. <code>/task</code> contains <code>/task/42</code>
 * but not <code>/tasks/42</code>. The root subject <code>/</code> contains every subject.
 */
public class Subject extends CharSequenceType<Subject> {
    public static final String SEPARATOR = "/";
    public static final Subject ROOT     = new Subject(SEPARATOR);

    public Subject(CharSequence value) {
        super(value);
        requireTrue(value.length() > 0, "A subject cannot be empty");
    }

    public static Subject of(CharSequence value) {
        return new Subject(value);
    }

    /**
     * @param other the subject to check
     * @return true if <code>other</code> is this subject or one of its descendants
     */
    public boolean contains(Subject other) {
        requireNonNull(other, "You must supply the other subject");
        var thisSubject  = toString();
        var otherSubject = other.toString();
        if (thisSubject.equals(otherSubject)) {
            return true;
        }
        var prefix = thisSubject.endsWith(SEPARATOR) ? thisSubject : thisSubject + SEPARATOR;
        return otherSubject.startsWith(prefix);
    }

    /**
     * The non-empty path segments, e.g. <code>/task/42</code> has the segments <code>task</code> and <code>42</code>
     */
    public List<String> segments() {
        return Arrays.stream(toString().split(SEPARATOR))
                     .filter(segment -> !segment.isEmpty())
                     .collect(Collectors.toList());
    }

    /**
     * Keep the first <code>level</code> path segments, e.g. <code>/a/b/c</code> truncated to level 2 is <code>/a/b</code>
     *
     * @param level the number of segments to keep (must be 1 or larger)
     * @return the truncated subject (or this subject if it has fewer segments)
     */
    public Subject truncate(int level) {
        requireTrue(level >= 1, "level must be 1 or larger");
        return Subject.of(SEPARATOR + segments().stream()
                                                .limit(level)
                                                .collect(Collectors.joining(SEPARATOR)));
    }
}
