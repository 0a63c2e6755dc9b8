package com.tempvoice.voice.model;

/**
 * The subject of a permission rule or overwrite: a single member or a role.
 * A guild's {@code @everyone} role shares the guild id.
 */
public sealed interface TargetRef {

    long id();

    /** Storage discriminator, {@code "member"} or {@code "role"}. */
    String type();

    record Member(long id) implements TargetRef {
        @Override
        public String type() {
            return "member";
        }
    }

    record Role(long id) implements TargetRef {
        @Override
        public String type() {
            return "role";
        }
    }

    static TargetRef member(long id) {
        return new Member(id);
    }

    static TargetRef role(long id) {
        return new Role(id);
    }

    static TargetRef everyone(long guildId) {
        return new Role(guildId);
    }

    static TargetRef of(String type, long id) {
        return switch (type) {
            case "member" -> new Member(id);
            case "role" -> new Role(id);
            default -> throw new IllegalArgumentException("Unknown target type: " + type);
        };
    }
}
