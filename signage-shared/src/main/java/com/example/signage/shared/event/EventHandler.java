package com.example.signage.shared.event;

import java.util.Map;

@FunctionalInterface
public interface EventHandler {

    void handle(String topic, Map<String, Object> payload);
}
