package me.golemcore.converse.domain.loop;

import me.golemcore.converse.domain.model.InboundMessage;
import me.golemcore.converse.domain.service.IdentityRunCoordinator;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.mockito.Mockito.*;

class InboundMessageListenerTest {

    @Test
    void shouldEnqueueInboundMessage() {
        IdentityRunCoordinator coordinator = mock(IdentityRunCoordinator.class);
        InboundMessageListener listener = new InboundMessageListener(coordinator);
        InboundMessage message = InboundMessage.builder()
                .messageId("m-1")
                .ownerId("owner-1")
                .rawAddress("237691234567@s.whatsapp.net")
                .content("Bonjour")
                .build();

        listener.onInboundMessage(new ConversationPipeline.InboundMessageEvent(message, Instant.EPOCH));

        verify(coordinator).enqueue(message);
    }
}
