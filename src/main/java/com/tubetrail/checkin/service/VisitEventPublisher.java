package com.tubetrail.checkin.service;

import com.tubetrail.checkin.dto.CheckinSuccessResponse;
import com.tubetrail.checkin.entity.StationVisit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes stored visits to /topic/activities/{activityId}/visits so an open
 * activity screen can update without polling.
 *
 * Called after commit. A failed push is logged and dropped; the visit is
 * already durable and clients can re-read it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisitEventPublisher {

    static final String TOPIC_TEMPLATE = "/topic/activities/%s/visits";

    private final SimpMessagingTemplate messagingTemplate;

    public void visitRecorded(StationVisit visit) {
        String destination = String.format(TOPIC_TEMPLATE, visit.getActivityId());
        try {
            messagingTemplate.convertAndSend(destination, CheckinSuccessResponse.from(visit));
            log.debug("WS: visit {} published to {}", visit.getId(), destination);
        } catch (MessagingException e) {
            log.warn("WS: publish to {} failed: {}", destination, e.getMessage());
        }
    }
}
