package com.example.hotelconcierge.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public class ResolveConversationRequest {

    @Min(1)
    @Max(5)
    private Integer satisfactionScore;

    public Integer getSatisfactionScore() { return satisfactionScore; }
    public void setSatisfactionScore(Integer satisfactionScore) { this.satisfactionScore = satisfactionScore; }
}
