package com.gt.lse.model;

public enum InteractionKind {
    Answer,
    ConversationTurn
}
