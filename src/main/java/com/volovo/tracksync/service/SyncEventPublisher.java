package com.volovo.tracksync.service;

import com.volovo.tracksync.dto.DeviceSyncResult;
import com.volovo.tracksync.dto.SyncEventType;
import com.volovo.tracksync.dto.SyncReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Broadcasts sync progress to dashboard subscribers of {@code /topic/sync-events}.
 * A failed broadcast never affects the sync itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncEventPublisher {

    static final String TOPIC = "/topic/sync-events";

    private final SimpMessagingTemplate messagingTemplate;

    public void deviceFinished(DeviceSyncResult result) {
        Map<String, Object> msg = base(result.isFailed() ? SyncEventType.DEVICE_FAILED : SyncEventType.DEVICE_SYNCED);
        msg.put("deviceId", result.getDeviceId());
        msg.put("status", result.getStatus().name());
        msg.put("fetched", result.getFetched());
        msg.put("inserted", result.getInserted());
        msg.put("matched", result.getMatched());
        msg.put("failedWindows", result.getFailedWindows());
        if (result.getError() != null) {
            msg.put("error", result.getError());
        }
        send(msg);
    }

    public void runFinished(SyncReport report) {
        Map<String, Object> msg = base(SyncEventType.RUN_FINISHED);
        msg.put("devices", report.getDevices().size());
        msg.put("failedDevices", report.getFailedDevices());
        msg.put("inserted", report.getTotalInserted());
        msg.put("matched", report.getTotalMatched());
        msg.put("exitCode", report.exitCode());
        send(msg);
    }

    private static Map<String, Object> base(SyncEventType type) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", type.name());
        msg.put("timestamp", LocalDateTime.now().toString());
        return msg;
    }

    private void send(Map<String, Object> msg) {
        try {
            messagingTemplate.convertAndSend(TOPIC, msg);
            log.debug("WS sync-event: {}", msg.get("type"));
        } catch (MessagingException e) {
            log.warn("WS sync-event {} not delivered: {}", msg.get("type"), e.getMessage());
        }
    }
}
