package org.adseller.server.audience.model;

public enum EmbeddingType {

    context, creative, user_intent, inventory, query
}
