package com.meltwater.syncrabbit;

import com.meltwater.syncrabbit.broker.InMemoryBroker;
import com.meltwater.syncrabbit.util.Logger;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;

/**
 * Logs the failing test together with what the in memory broker looked like at that point.
 *
 * gist http://www.thinkcode.se/blog/2012/07/08/performing-an-action-when-a-test-fails
 */
public class LogFailuresRule extends TestWatcher {

    private static final Logger log = new Logger(LogFailuresRule.class);
    private final InMemoryBroker broker;

    public LogFailuresRule(InMemoryBroker broker) {
        this.broker = broker;
    }

    @Override
    protected void failed(Throwable e, Description description) {
        log.errorWithParams("TEST FAILED", e, "name", description.toString());
        log.infoWithParams("****** Broker state ******",
                "openSessions", broker.openSessionCount(),
                "unacked", broker.unackedCount(),
                "returned", broker.returnedRoutingKeys());
    }
}
