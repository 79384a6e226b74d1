package com.phillippitts.voicecompanion.service.voice.transport;

public enum PlayerStatus {
    IDLE,
    BUFFERING,
    PLAYING,
    PAUSED,
    AUTO_PAUSED
}
