package com.medidesk.service;

import com.medidesk.event.BedStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes committed bed status changes to bed board subscribers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BedBoardNotifier {

    static final String DESTINATION = "/topic/beds";

    private final SimpMessagingTemplate messagingTemplate;

    // Rolled-back changes are never broadcast.
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBedStatusChanged(BedStatusChangedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bedId", event.getBedId());
        payload.put("bedNumber", event.getBedNumber());
        payload.put("wardType", event.getWardType());
        payload.put("status", event.getStatus());
        payload.put("admissionId", event.getAdmissionId());
        try {
            messagingTemplate.convertAndSend(DESTINATION, payload);
            log.debug("Sent bed update for {}: {}", event.getBedNumber(), event.getStatus());
        } catch (MessagingException e) {
            // already committed; a missed broadcast is only logged
            log.warn("Could not broadcast bed update for {}: {}", event.getBedNumber(), e.getMessage());
        }
    }
}
