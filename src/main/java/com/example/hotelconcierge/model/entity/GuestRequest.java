package com.example.hotelconcierge.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Locale;

@Entity
@Table(
        name = "guest_request",
        indexes = {
                @Index(name = "idx_guest_request_status", columnList = "status"),
                @Index(name = "idx_guest_request_conversation", columnList = "conversationId")
        }
)
public class GuestRequest {

    public enum Type {
        ROOM_SERVICE, CONCIERGE, MAINTENANCE, HOUSEKEEPING, COMPLAINT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Priority {
        LOW, MEDIUM, HIGH, URGENT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Priority fromWireName(String value) {
            String clean = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
            try {
                return Priority.valueOf(clean);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Prioridad no valida: " + value, e);
            }
        }
    }

    public enum Status {
        PENDING, IN_PROGRESS, COMPLETED, CANCELLED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Status fromWireName(String value) {
            String clean = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
            try {
                return Status.valueOf(clean);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Estado de peticion no valido: " + value, e);
            }
        }
    }

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36)
    private String conversationId;

    @Column(nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Type type;

    @Column(nullable = false, length = 255)
    private String title;

    @Lob
    @Column(nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Priority priority = Priority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.PENDING;

    @Column(length = 10)
    private String roomNumber;

    @Column(length = 100)
    private String assignedTo;

    @Lob
    private String notes;

    private Instant completedAt;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    @Column(nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Type getType() { return type; }
    public void setType(Type type) { this.type = type; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }

    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }

    public String getRoomNumber() { return roomNumber; }
    public void setRoomNumber(String roomNumber) { this.roomNumber = roomNumber; }

    public String getAssignedTo() { return assignedTo; }
    public void setAssignedTo(String assignedTo) { this.assignedTo = assignedTo; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
