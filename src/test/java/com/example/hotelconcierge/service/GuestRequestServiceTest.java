package com.example.hotelconcierge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.hotelconcierge.model.dto.GuestRequestDto;
import com.example.hotelconcierge.model.dto.UpdateRequestStatusRequest;
import com.example.hotelconcierge.model.entity.GuestRequest;
import com.example.hotelconcierge.repository.GuestRequestRepository;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GuestRequestServiceTest {

    private final GuestRequestRepository repo = mock(GuestRequestRepository.class);
    private final GuestRequestService service = new GuestRequestService(repo);

    @BeforeEach
    void setUp() {
        when(repo.save(any(GuestRequest.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void listTranslatesFilters() {
        GuestRequest r = request("r-1");
        when(repo.search(GuestRequest.Status.PENDING, GuestRequest.Priority.URGENT)).thenReturn(List.of(r));

        List<GuestRequestDto> out = service.list("pending", "URGENT");

        assertThat(out).extracting(GuestRequestDto::id).containsExactly("r-1");
        assertThat(out.get(0).status()).isEqualTo("pending");
        assertThat(out.get(0).type()).isEqualTo("room_service");
    }

    @Test
    void listWithoutFiltersPassesNulls() {
        when(repo.search(null, null)).thenReturn(List.of());

        assertThat(service.list(null, " ")).isEmpty();
        verify(repo).search(null, null);
    }

    @Test
    void unknownFilterValueIsRejected() {
        assertThatThrownBy(() -> service.list("done", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.list(null, "critical")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void completingStampsCompletedAtOnlyOnce() {
        GuestRequest r = request("r-2");
        when(repo.findById("r-2")).thenReturn(Optional.of(r));

        GuestRequestDto first = service.updateStatus("r-2", update("completed", "maria", "Delivered"));
        Instant stamped = first.completedAt();

        assertThat(first.status()).isEqualTo("completed");
        assertThat(first.assignedTo()).isEqualTo("maria");
        assertThat(first.notes()).isEqualTo("Delivered");
        assertThat(stamped).isNotNull();

        GuestRequestDto second = service.updateStatus("r-2", update("completed", null, null));
        assertThat(second.completedAt()).isEqualTo(stamped);
        assertThat(second.assignedTo()).isEqualTo("maria");
    }

    @Test
    void inProgressDoesNotStampCompletion() {
        GuestRequest r = request("r-3");
        when(repo.findById("r-3")).thenReturn(Optional.of(r));

        GuestRequestDto out = service.updateStatus("r-3", update("in_progress", "luis", null));

        assertThat(out.status()).isEqualTo("in_progress");
        assertThat(out.completedAt()).isNull();
    }

    @Test
    void unknownRequestIsNotFound() {
        when(repo.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateStatus("missing", update("completed", null, null)))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void updateWithoutStatusKeepsCurrentStatus() {
        GuestRequest r = request("r-4");
        r.setStatus(GuestRequest.Status.IN_PROGRESS);
        when(repo.findById("r-4")).thenReturn(Optional.of(r));

        GuestRequestDto out = service.updateStatus("r-4", update(null, "carla", "Guest asked for two"));

        assertThat(out.status()).isEqualTo("in_progress");
        assertThat(out.assignedTo()).isEqualTo("carla");
        assertThat(out.notes()).isEqualTo("Guest asked for two");
        assertThat(out.completedAt()).isNull();
    }

    private static GuestRequest request(String id) {
        GuestRequest r = new GuestRequest();
        r.setId(id);
        r.setConversationId("conv-1");
        r.setUserId("guest-1");
        r.setType(GuestRequest.Type.ROOM_SERVICE);
        r.setTitle("Extra towels");
        r.setDescription("Extra towels please");
        return r;
    }

    private static UpdateRequestStatusRequest update(String status, String assignedTo, String notes) {
        UpdateRequestStatusRequest req = new UpdateRequestStatusRequest();
        req.setStatus(status);
        req.setAssignedTo(assignedTo);
        req.setNotes(notes);
        return req;
    }
}
