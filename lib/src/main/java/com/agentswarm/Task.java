package com.agentswarm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work handed to an actor.
 * <p>
 * The context map preserves insertion order and may hold null values; it is read-only once
 * the task is built. Dependencies are informational task ids and are not enforced.
 *
 * @param id           unique task id
 * @param description  free-form description
 * @param payload      opaque task input, may be null
 * @param priority     informational priority, lower runs earlier by convention
 * @param context      accumulated outputs of earlier work
 * @param dependencies ids of tasks this one builds on
 */
public record Task(String id,
                   String description,
                   Object payload,
                   int priority,
                   Map<String, Object> context,
                   List<String> dependencies) {

    public Task {
        Objects.requireNonNull(id, "id");
        description = description == null ? "" : description;
        context = context == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static Task of(String id, String description) {
        return builder(id).description(description).build();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String description = "";
        private Object payload;
        private int priority;
        private Map<String, Object> context = new LinkedHashMap<>();
        private List<String> dependencies = List.of();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = new LinkedHashMap<>(context);
            return this;
        }

        public Builder putContext(String key, Object value) {
            this.context.put(key, value);
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Task build() {
            return new Task(id, description, payload, priority, context, dependencies);
        }
    }
}
