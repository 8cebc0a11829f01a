package org.adseller.server.audience.proto;

public enum SignalType {

    identity, contextual, reinforcement
}
