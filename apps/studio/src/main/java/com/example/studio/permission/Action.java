package com.example.studio.permission;

public enum Action {
    VIEW,
    CREATE,
    EDIT,
    DELETE
}
