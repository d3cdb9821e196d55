package com.example.signage.shared.util;

public final class Constants {

    private Constants() {}

    /**
     * Event bus topics.
     */
    public static final class Topics {
        private Topics() {}
        public static final String SCHEDULE_CREATED = "schedule.created";
        public static final String SCHEDULE_UPDATED = "schedule.updated";
        public static final String SCHEDULE_DELETED = "schedule.deleted";
        public static final String SCHEDULE_TRIGGERED = "schedule.triggered";
        public static final String DISPLAY_CONTENT_CHANGED = "display.content.changed";
        public static final String DISPLAY_ONLINE = "display.online";
        public static final String DISPLAY_OFFLINE = "display.offline";
        public static final String DISPLAY_ERROR_HIGH = "display.error.high";
        public static final String DISPLAY_DEBUG = "display.debug";
        public static final String CONTENT_CREATED = "content.created";
        public static final String CONTENT_UPDATED = "content.updated";
        public static final String CONTENT_DELETED = "content.deleted";
        public static final String SETTINGS_UPDATED = "settings.updated";
        public static final String SETTINGS_FPCON_CHANGED = "settings.fpcon.changed";
        public static final String SETTINGS_LAN_CHANGED = "settings.lan.changed";

        public static String displayContentChanged(Long displayId) {
            return "display." + displayId + ".content.changed";
        }
    }

    public enum DisplayStatus {
        ONLINE,
        OFFLINE
    }

    public enum ErrorSeverity {
        LOW,
        MEDIUM,
        HIGH
    }

    public enum TargetType {
        DISPLAY,
        GROUP
    }

    public enum PayloadType {
        CONTENT,
        CONTENT_LIST,
        PLAYLIST
    }

    public enum SseEventType {
        CONNECTED("connected"),
        HEARTBEAT("heartbeat"),
        SERVER_SHUTDOWN("server.shutdown"),
        CONTENT_CHANGED("content.changed"),
        CONTENT_UPDATE("content.update"),
        SETTINGS_CHANGED("settings.changed"),
        FPCON_CHANGED("fpcon.changed"),
        LAN_CHANGED("lan.changed"),
        SCHEDULE_CHANGED("schedule.changed"),
        SCHEDULE_TRIGGERED("schedule.triggered"),
        DISPLAY_STATUS("display.status"),
        DISPLAY_ERROR("display.error"),
        DEBUG_TOGGLE("debug.toggle");

        private final String wireName;

        SseEventType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }
}
