package net.wsrooms.room;

import net.wsrooms.util.config.DynamicConfiguration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RoomSettingsTest {

    @Test
    public void missingKeysYieldDefaults() {
        RoomSettings s = RoomSettings.fromConfiguration(
            new DynamicConfiguration());

        assertEquals(RoomSettings.DEFAULT_HANDLER_TIMEOUT,
                     s.getHandlerTimeout());
        assertEquals(RoomSettings.DEFAULT_SEND_TIMEOUT, s.getSendTimeout());
        assertEquals(RoomSettings.BacklogPolicy.RETAIN, s.getBacklogPolicy());
    }

    @Test
    public void configuredValuesAreParsed() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put(RoomSettings.K_HANDLER_TIMEOUT, "250");
        config.put(RoomSettings.K_SEND_TIMEOUT, " 0 ");
        config.put(RoomSettings.K_BACKLOG, "Discard");
        RoomSettings s = RoomSettings.fromConfiguration(config);

        assertEquals(250, s.getHandlerTimeout());
        assertEquals(0, s.getSendTimeout());
        assertEquals(RoomSettings.BacklogPolicy.DISCARD,
                     s.getBacklogPolicy());
    }

    @Test
    public void badNumbersFallBackToDefaults() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put(RoomSettings.K_HANDLER_TIMEOUT, "soon");
        config.put(RoomSettings.K_SEND_TIMEOUT, "-5");
        RoomSettings s = RoomSettings.fromConfiguration(config);

        assertEquals(RoomSettings.DEFAULT_HANDLER_TIMEOUT,
                     s.getHandlerTimeout());
        assertEquals(RoomSettings.DEFAULT_SEND_TIMEOUT, s.getSendTimeout());
    }

    @Test
    public void unknownBacklogPolicyFailsFast() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put(RoomSettings.K_BACKLOG, "sometimes");

        assertThrows(IllegalArgumentException.class,
                     () -> RoomSettings.fromConfiguration(config));
    }

    @Test
    public void withersLeaveTheOriginalAlone() {
        RoomSettings s = RoomSettings.DEFAULTS.withSendTimeout(5);

        assertEquals(5, s.getSendTimeout());
        assertEquals(RoomSettings.DEFAULT_SEND_TIMEOUT,
                     RoomSettings.DEFAULTS.getSendTimeout());
        assertThrows(IllegalArgumentException.class,
                     () -> RoomSettings.DEFAULTS.withHandlerTimeout(-1));
    }

}
