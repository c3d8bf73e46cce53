package io.workledger.model;

/**
 * Address of a content inside a collection.
 *
 * <ul>
 *   <li>{@link Unranged}: a whole {@link ContentType#FILE}; min/max ids are not part of the key.</li>
 *   <li>{@link Ranged}: a typed sub-range {@code [minId, maxId]} of a logical name.</li>
 *   <li>{@link Untyped}: a range lookup that does not constrain the content type.</li>
 * </ul>
 */
public interface ContentIdentity {

    enum Kind { UNRANGED, RANGED, UNTYPED }

    Kind kind();

    long collId();

    String scope();

    String name();

    static ContentIdentity of(long collId, String scope, String name, ContentType type, Long minId, Long maxId) {
        if (type == null) {
            return new Untyped(collId, scope, name, minId, maxId);
        }
        if (type == ContentType.FILE) {
            return new Unranged(collId, scope, name);
        }
        return new Ranged(collId, scope, name, type, minId, maxId);
    }

    record Unranged(long collId, String scope, String name) implements ContentIdentity {
        @Override
        public Kind kind() {
            return Kind.UNRANGED;
        }
    }

    record Ranged(long collId, String scope, String name, ContentType contentType, Long minId, Long maxId)
            implements ContentIdentity {
        @Override
        public Kind kind() {
            return Kind.RANGED;
        }
    }

    record Untyped(long collId, String scope, String name, Long minId, Long maxId) implements ContentIdentity {
        @Override
        public Kind kind() {
            return Kind.UNTYPED;
        }
    }
}
