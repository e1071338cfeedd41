package dev.mcpr.transport;

public enum TransportState {
    IDLE, CONNECTED, CLOSED
}
