package com.bank.dispute.service;

import com.bank.dispute.config.MetricsConfig;
import com.bank.dispute.config.NotifierConfig;
import com.bank.dispute.model.Signal;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TwilioSignalNotifier implements SignalNotifier {

    private static final Logger log = LoggerFactory.getLogger(TwilioSignalNotifier.class);

    private final NotifierConfig.Twilio config;
    private final MetricsConfig metricsConfig;

    public TwilioSignalNotifier(NotifierConfig notifierConfig, MetricsConfig metricsConfig) {
        this.config = notifierConfig.getTwilio();
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio signal notifier initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio signal notifier is DISABLED; signals are logged only.");
        }
    }

    @Override
    public void deliver(Signal signal) {
        if (!config.isEnabled()) {
            log.warn("[{}] dispute={} {}", signal.getKind(), signal.getDisputeId(), signal.getDetail());
            metricsConfig.recordNotification("log", "success");
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(signal)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Signal {} sent for dispute={}, sid={}", signal.getKind(), signal.getDisputeId(), message.getSid());
        } catch (RuntimeException e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            throw e;
        }
    }

    private String buildMessageBody(Signal signal) {
        return String.format(
                "[DISPUTE %s]\n" +
                "Dispute: %s\n" +
                "At: %s\n" +
                "%s",
                signal.getKind(),
                signal.getDisputeId() != null ? signal.getDisputeId() : "-",
                signal.getOccurredAt(),
                signal.getDetail());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
