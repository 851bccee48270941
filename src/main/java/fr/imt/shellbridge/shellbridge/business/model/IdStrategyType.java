package fr.imt.shellbridge.shellbridge.business.model;

public enum IdStrategyType {
    USER_HOST_PORT,
    UNIQUE
}
