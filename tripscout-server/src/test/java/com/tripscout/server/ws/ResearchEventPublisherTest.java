package com.tripscout.server.ws;

import com.tripscout.pojo.research.ResearchProgress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ResearchEventPublisherTest {

    @Mock
    private ConnectionRegistry connectionRegistry;

    @InjectMocks
    private ResearchEventPublisher publisher;

    @Test
    @SuppressWarnings("unchecked")
    void researchProgress_shouldPublishToJobScope() {
        publisher.researchProgress(ResearchProgress.of("job-1", "researching_weather", "Checking weather...", 2, 9));

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(connectionRegistry).publish(eq(SubscriptionScope.JOB), eq("job-1"), captor.capture());
        Map<String, Object> event = captor.getValue();
        assertEquals("progress", event.get("type"));
        assertEquals("researching_weather", event.get("step"));
        assertEquals(22, event.get("percentage"));
        assertEquals(2, event.get("completed_steps"));
        assertEquals(9, event.get("total_steps"));
    }

    @Test
    void jobFinished_shouldSkipAnonymousJobs() {
        publisher.jobFinished(null, "job-1", "completed");

        verify(connectionRegistry, never()).publish(any(), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void announce_shouldBroadcast() {
        publisher.announce("maintenance at 02:00");

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(connectionRegistry).broadcast(captor.capture());
        assertEquals("announcement", captor.getValue().get("type"));
        assertEquals("maintenance at 02:00", captor.getValue().get("message"));
    }
}
