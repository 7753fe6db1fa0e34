package com.baykanat.ephemeral.domain.model;

/** Gateway köprüsünden gelen olay türleri. */
public enum GatewayEventType {

    MESSAGE_CREATED,
    PINS_UPDATED,
    READY,
    RESUMED;

    /** Bu tür bir kanal id'si gerektiriyor mu. */
    public boolean requiresChannel() {
        return this == MESSAGE_CREATED || this == PINS_UPDATED;
    }
}
