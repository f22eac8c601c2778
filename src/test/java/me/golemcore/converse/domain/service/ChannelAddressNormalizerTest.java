package me.golemcore.converse.domain.service;

import me.golemcore.converse.domain.exception.IdentityNotResolvableException;
import me.golemcore.converse.domain.model.ConversationIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ChannelAddressNormalizerTest {

    private static final String OWNER = "owner-1";

    @Test
    void stripsChannelSuffixAndDeviceId() {
        assertEquals("237691234567", ChannelAddressNormalizer.normalize("237691234567@s.whatsapp.net"));
        assertEquals("237691234567", ChannelAddressNormalizer.normalize("237691234567:3@s.whatsapp.net"));
        assertEquals("237691234567", ChannelAddressNormalizer.normalize(" +237 691-234-567 "));
    }

    @Test
    void recognizesGroupAddresses() {
        assertEquals("group:120363040000000000", ChannelAddressNormalizer.normalize("120363040000000000@g.us"));
        assertEquals("group:abc-123", ChannelAddressNormalizer.normalize("GROUP:Abc-123"));
        assertTrue(ChannelAddressNormalizer.isGroup("120363040000000000@g.us"));
        assertFalse(ChannelAddressNormalizer.isGroup("237691234567@s.whatsapp.net"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "237691234567@s.whatsapp.net", "+237 691 234 567", "120363040000000000@g.us",
            "group:abc-123", "237691234567:12@s.whatsapp.net" })
    void normalizationIsIdempotent(String raw) {
        String once = ChannelAddressNormalizer.normalize(raw);
        assertEquals(once, ChannelAddressNormalizer.normalize(once));
    }

    @Test
    void addressesWithAndWithoutSuffixResolveToSameIdentity() {
        ConversationIdentity withSuffix = ChannelAddressNormalizer.resolve(OWNER, "237691234567@s.whatsapp.net");
        ConversationIdentity withoutSuffix = ChannelAddressNormalizer.resolve(OWNER, "237691234567");

        assertEquals(withSuffix.key(), withoutSuffix.key());
        assertEquals("237691234567@s.whatsapp.net", withSuffix.channelAddress());
        assertFalse(withSuffix.group());
    }

    @Test
    void sameAddressUnderDifferentOwnersIsDifferentIdentity() {
        ConversationIdentity first = ChannelAddressNormalizer.resolve("owner-1", "237691234567");
        ConversationIdentity second = ChannelAddressNormalizer.resolve("owner-2", "237691234567");

        assertNotEquals(first.key(), second.key());
    }

    @Test
    void rejectsMissingOwner() {
        assertThrows(IdentityNotResolvableException.class,
                () -> ChannelAddressNormalizer.resolve(" ", "237691234567"));
    }

    @Test
    void rejectsAddressWithoutUsableId() {
        assertThrows(IdentityNotResolvableException.class, () -> ChannelAddressNormalizer.resolve(OWNER, "@@@"));
        assertThrows(IdentityNotResolvableException.class, () -> ChannelAddressNormalizer.resolve(OWNER, null));
        assertThrows(IdentityNotResolvableException.class,
                () -> ChannelAddressNormalizer.resolve(OWNER, "1".repeat(65)));
    }

    @Test
    void mapsNormalizedAddressBackToChannelFormat() {
        assertEquals("237691234567@s.whatsapp.net", ChannelAddressNormalizer.toChannelAddress("237691234567"));
        assertEquals("abc-123@g.us", ChannelAddressNormalizer.toChannelAddress("group:abc-123"));
    }

    @Test
    void displayNameFallsBackToAddress() {
        assertEquals("+237691234567", ChannelAddressNormalizer.displayName("237691234567"));
        assertEquals("Group abc", ChannelAddressNormalizer.displayName("group:abc"));
    }
}
