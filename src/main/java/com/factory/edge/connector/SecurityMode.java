package com.factory.edge.connector;

/** OPC UA message security mode. */
public enum SecurityMode {
    NONE,
    SIGN,
    SIGN_AND_ENCRYPT
}
