package com.example.hotelconcierge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.hotelconcierge.model.analysis.GuestContext;
import com.example.hotelconcierge.model.analysis.Intent;
import com.example.hotelconcierge.model.entity.GuestRequest;
import com.example.hotelconcierge.model.request.GuestRequestFields;
import com.example.hotelconcierge.model.request.RecordedRequest;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class GuestRequestExtractorTest {

    private final GuestRequestSink sink = mock(GuestRequestSink.class);
    private final GuestRequestExtractor extractor = new GuestRequestExtractor(sink);

    @Test
    void recordableIntentCreatesOneRequest() {
        when(sink.createRequest(any())).thenReturn("3f2b1c9a-1111-2222-3333-444455556666");
        GuestContext guest = new GuestContext("guest-1", "Ana", "204", "vip");

        Optional<RecordedRequest> recorded = extractor.maybeExtract(
                "conv-1", "guest-1", "I need extra towels in room 204", Intent.SERVICE_REQUEST, guest);

        assertThat(recorded).isPresent();
        assertThat(recorded.get().confirmation())
                .isEqualTo("Request #3f2b1c9a has been recorded and will be processed.");

        ArgumentCaptor<GuestRequestFields> captor = ArgumentCaptor.forClass(GuestRequestFields.class);
        verify(sink).createRequest(captor.capture());
        GuestRequestFields fields = captor.getValue();
        assertThat(fields.type()).isEqualTo(GuestRequest.Type.ROOM_SERVICE);
        assertThat(fields.title()).isEqualTo("I need extra towels in room 204");
        assertThat(fields.description()).isEqualTo("I need extra towels in room 204");
        assertThat(fields.priority()).isEqualTo(GuestRequest.Priority.MEDIUM);
        assertThat(fields.roomNumber()).isEqualTo("204");
        assertThat(fields.conversationId()).isEqualTo("conv-1");
    }

    @Test
    void nonRecordableIntentDoesNothing() {
        Optional<RecordedRequest> recorded = extractor.maybeExtract(
                "conv-1", "guest-1", "I want to book a room", Intent.BOOKING, GuestContext.empty());

        assertThat(recorded).isEmpty();
        verifyNoInteractions(sink);
    }

    @Test
    void failingSinkYieldsNoRecordedRequest() {
        when(sink.createRequest(any())).thenThrow(new IllegalStateException("store unavailable"));

        Optional<RecordedRequest> recorded = extractor.maybeExtract(
                "conv-2", "guest-1", "Please bring more pillows", Intent.SERVICE_REQUEST, GuestContext.empty());

        assertThat(recorded).isEmpty();
    }

    @Test
    void conciergeAndGuestRequestsMapToConciergeType() {
        assertThat(GuestRequestExtractor.requestType(Intent.CONCIERGE_REQUEST)).isEqualTo(GuestRequest.Type.CONCIERGE);
        assertThat(GuestRequestExtractor.requestType(Intent.GUEST_REQUEST)).isEqualTo(GuestRequest.Type.CONCIERGE);
        assertThat(GuestRequestExtractor.isRecordable(Intent.COMPLAINT)).isFalse();
    }

    @Test
    void titleKeepsTheFirstEightWords() {
        assertThat(GuestRequestExtractor.title("  Could you please arrange a taxi to the airport tomorrow morning "))
                .isEqualTo("Could you please arrange a taxi to the");
    }

    @Test
    void priorityFollowsUrgencyWords() {
        assertThat(GuestRequestExtractor.priority("Please send someone IMMEDIATELY"))
                .isEqualTo(GuestRequest.Priority.URGENT);
        assertThat(GuestRequestExtractor.priority("It is important, please come soon"))
                .isEqualTo(GuestRequest.Priority.HIGH);
        assertThat(GuestRequestExtractor.priority("Extra pillows please"))
                .isEqualTo(GuestRequest.Priority.MEDIUM);
    }
}
