package com.example.paylog.service;

import com.example.paylog.model.PipelineEvent;

/**
 * Observer of pipeline lifecycle events. Runs on the event bus thread; the event instance is
 * reused after the call returns.
 */
public interface PipelineEventListener {
    void onEvent(PipelineEvent event);
}
