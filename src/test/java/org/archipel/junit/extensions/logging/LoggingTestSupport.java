package org.archipel.junit.extensions.logging;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.archipel.node.config.LoggingConfigurator;
import org.slf4j.LoggerFactory;

import java.net.URL;

/**
 * Undoes what {@link LoggingConfigurator} does to the shared logger context, so that tests
 * running later in the same JVM log through {@code logback-test.xml} again.
 */
public final class LoggingTestSupport {

    private LoggingTestSupport() {
    }

    public static void restoreTestConfiguration() {
        LoggingConfigurator.reset();
        System.clearProperty("archipel.logging.format");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        URL testConfig = LoggingTestSupport.class.getClassLoader().getResource("logback-test.xml");
        if (testConfig == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(testConfig);
        } catch (JoranException e) {
            throw new IllegalStateException("cannot restore logback-test.xml", e);
        }
    }
}
