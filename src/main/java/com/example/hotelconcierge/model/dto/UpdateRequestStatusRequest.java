package com.example.hotelconcierge.model.dto;

import jakarta.validation.constraints.Size;

public class UpdateRequestStatusRequest {

    /**
     * pending, in_progress, completed o cancelled. Si falta se conserva el estado actual.
     */
    private String status;

    @Size(max = 100)
    private String assignedTo;

    private String notes;

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getAssignedTo() { return assignedTo; }
    public void setAssignedTo(String assignedTo) { this.assignedTo = assignedTo; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
