package com.portray.portal.features.terminals.app;

import com.portray.portal.features.notifications.app.NotificationService;
import com.portray.portal.features.terminals.domain.Terminal;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Lifecycle notifications: review requests go to every active SystemAdmin, outcomes to the
 * user who submitted the terminal.
 */
@Component
public class TerminalNotifier {

    static final String ACTIVATION_REQUEST = "terminal_activation_request";
    static final String APPROVED = "terminal_approved";
    static final String REJECTED = "terminal_rejected";

    private final NotificationService notificationService;

    public TerminalNotifier(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    public void activationRequested(Terminal terminal) {
        notificationService.notifySystemAdmins(
                ACTIVATION_REQUEST,
                "New Terminal Activation Request",
                "Terminal '" + terminal.getTerminalName() + "' (" + terminal.getShortCode()
                        + ") is awaiting activation",
                data(terminal));
    }

    public void approved(Terminal terminal) {
        if (terminal.getCreatedBy() == null) {
            return;
        }
        notificationService.notify(
                terminal.getCreatedBy(),
                APPROVED,
                "Terminal Activated",
                "Terminal '" + terminal.getTerminalName() + "' is active until " + terminal.getActivationEndDate(),
                data(terminal));
    }

    public void rejected(Terminal terminal) {
        if (terminal.getCreatedBy() == null) {
            return;
        }
        notificationService.notify(
                terminal.getCreatedBy(),
                REJECTED,
                "Terminal Rejected",
                "Terminal '" + terminal.getTerminalName() + "' was rejected",
                data(terminal));
    }

    private static Map<String, Object> data(Terminal terminal) {
        Map<String, Object> data = new HashMap<>();
        data.put("terminalId", terminal.getId());
        data.put("portId", terminal.getPortId());
        data.put("terminalName", terminal.getTerminalName());
        data.put("shortCode", terminal.getShortCode());
        data.put("status", terminal.getStatus().getLabel());
        return data;
    }
}
