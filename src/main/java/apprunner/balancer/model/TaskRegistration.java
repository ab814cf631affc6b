package apprunner.balancer.model;

import apprunner.common.model.TaskStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Balancer-side record of an issued ticket: which worker owns it and the last
 * status observed. The assigned worker never changes after creation.
 */
public final class TaskRegistration {
    private final String ticket;
    private final String workerId;
    private final String project;
    private final String userId; // advisory
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TaskRegistration(Builder builder) {
        this.ticket = Objects.requireNonNull(builder.ticket, "ticket is required");
        this.workerId = Objects.requireNonNull(builder.workerId, "workerId is required");
        this.project = Objects.requireNonNull(builder.project, "project is required");
        this.userId = builder.userId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String ticket() {
        return ticket;
    }

    public String workerId() {
        return workerId;
    }

    public String project() {
        return project;
    }

    public String userId() {
        return userId;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .ticket(ticket)
                .workerId(workerId)
                .project(project)
                .userId(userId)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskRegistration that))
            return false;
        return ticket.equals(that.ticket);
    }

    @Override
    public int hashCode() {
        return ticket.hashCode();
    }

    @Override
    public String toString() {
        return "TaskRegistration{ticket='" + ticket + "', workerId='" + workerId
                + "', project='" + project + "', status=" + status + '}';
    }

    public static final class Builder {
        private String ticket;
        private String workerId;
        private String project;
        private String userId;
        private TaskStatus status = TaskStatus.CREATED;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder ticket(String ticket) {
            this.ticket = ticket;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TaskRegistration build() {
            return new TaskRegistration(this);
        }
    }
}
