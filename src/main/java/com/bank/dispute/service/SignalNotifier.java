package com.bank.dispute.service;

import com.bank.dispute.model.Signal;

/**
 * Outbound channel for operational signals. A thrown exception marks the
 * delivery attempt as failed.
 */
public interface SignalNotifier {

    void deliver(Signal signal);
}
