package com.agentswarm;

import java.util.Objects;

/**
 * Content of a {@link Message}. The variant determines the message type.
 */
public sealed interface Payload
        permits Payload.TaskAssignment, Payload.TaskReport, Payload.Broadcast, Payload.Query {

    MessageType type();

    <R> R accept(PayloadVisitor<R> visitor);

    record TaskAssignment(Task task) implements Payload {
        public TaskAssignment {
            Objects.requireNonNull(task, "task");
        }

        @Override
        public MessageType type() {
            return MessageType.TASK;
        }

        @Override
        public <R> R accept(PayloadVisitor<R> visitor) {
            return visitor.visitTask(this);
        }
    }

    record TaskReport(TaskResult result) implements Payload {
        public TaskReport {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public MessageType type() {
            return MessageType.RESULT;
        }

        @Override
        public <R> R accept(PayloadVisitor<R> visitor) {
            return visitor.visitResult(this);
        }
    }

    /** Wraps the original content of a message sent to every actor. */
    record Broadcast(Payload content) implements Payload {
        public Broadcast {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public MessageType type() {
            return MessageType.BROADCAST;
        }

        @Override
        public <R> R accept(PayloadVisitor<R> visitor) {
            return visitor.visitBroadcast(this);
        }
    }

    record Query(String question) implements Payload {
        public Query {
            Objects.requireNonNull(question, "question");
        }

        @Override
        public MessageType type() {
            return MessageType.QUERY;
        }

        @Override
        public <R> R accept(PayloadVisitor<R> visitor) {
            return visitor.visitQuery(this);
        }
    }
}
