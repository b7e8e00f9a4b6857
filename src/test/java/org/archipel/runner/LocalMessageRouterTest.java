package org.archipel.runner;

import org.archipel.migration.IMessageRouter;
import org.archipel.migration.Mailbox;
import org.archipel.migration.Migrants;
import org.archipel.node.NodeId;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class LocalMessageRouterTest {

    private static final WorkerAddress LOCAL = new WorkerAddress(new NodeId("a", "localhost", 7700), 0);
    private static final WorkerAddress REMOTE = new WorkerAddress(new NodeId("b", "localhost", 7701), 1);
    private static final Migrants MIGRANTS = new Migrants(REMOTE, 1, new double[][]{{1}});

    @Mock
    private IMessageRouter remote;

    @Test
    void deliver_prefersLocalMailbox() {
        LocalMessageRouter router = new LocalMessageRouter(remote);
        Mailbox mailbox = new Mailbox(LOCAL, 4);
        router.register(mailbox);

        router.deliver(LOCAL, MIGRANTS);

        assertThat(router.mailboxOf(LOCAL)).isSameAs(mailbox);
        assertThat(mailbox.poll()).contains(MIGRANTS);
        verifyNoInteractions(remote);
    }

    @Test
    void deliver_forwardsUnknownTargetsToRemote() {
        new LocalMessageRouter(remote).deliver(REMOTE, MIGRANTS);

        verify(remote).deliver(REMOTE, MIGRANTS);
    }

    @Test
    void deliver_failsForUnknownTargetInLocalRun() {
        assertThatThrownBy(() -> new LocalMessageRouter(null).deliver(REMOTE, MIGRANTS))
            .isInstanceOf(IllegalStateException.class);
    }
}
