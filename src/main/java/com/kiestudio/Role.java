package com.kiestudio;

public enum Role {
    USER,
    LIMITED_ADMIN,
    PRIMARY_ADMIN;

    public boolean isAdmin() {
        return this != USER;
    }
}
