package com.tokenpool.backend.token.model;

/** EXPIRED 是終態：health tracker 不會再把它改回 ACTIVE */
public enum TokenStatus {
    ACTIVE,
    EXPIRED
}
