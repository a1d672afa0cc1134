package ru.oparin.omnihub.model.enums;

public enum WorkspaceRole {
    OWNER,
    MEMBER
}
