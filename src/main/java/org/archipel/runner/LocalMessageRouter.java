package org.archipel.runner;

import org.archipel.migration.IMessageRouter;
import org.archipel.migration.Mailbox;
import org.archipel.migration.Migrants;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes migrants to the mailboxes of workers in this process and hands everything else to
 * a remote router.
 */
public class LocalMessageRouter implements IMessageRouter {

    private final Map<WorkerAddress, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final IMessageRouter remote;

    /**
     * @param remote Delivers to workers in other processes, or {@code null} for a purely
     *               local run.
     */
    public LocalMessageRouter(IMessageRouter remote) {
        this.remote = remote;
    }

    public void register(Mailbox mailbox) {
        mailboxes.put(mailbox.owner(), mailbox);
    }

    public Mailbox mailboxOf(WorkerAddress address) {
        return mailboxes.get(address);
    }

    @Override
    public void deliver(WorkerAddress target, Migrants migrants) {
        Mailbox mailbox = mailboxes.get(target);
        if (mailbox != null) {
            mailbox.offer(migrants);
            return;
        }
        if (remote == null) {
            throw new IllegalStateException("no mailbox for worker " + target + " in this process");
        }
        remote.deliver(target, migrants);
    }
}
