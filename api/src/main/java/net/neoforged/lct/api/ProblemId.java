package net.neoforged.lct.api;

import java.util.Objects;

public record ProblemId(String id, String displayName, ProblemGroup group) {
    public ProblemId {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(group, "group");
    }

    public static ProblemId create(String id, String displayName, ProblemGroup group) {
        return new ProblemId(id, displayName, group);
    }

    @Override
    public String toString() {
        return group + ":" + id;
    }
}
