package com.questrail.bridge.runtime;

import com.questrail.bridge.config.BridgeConfig;
import com.questrail.bridge.config.BridgeConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.OutputStream;

/**
 * Entry point run by the daemon as an event listener.
 *
 * <p>Usage: {@code java -jar supervisor-bridge.jar [config.yml]}</p>
 *
 * <p>Standard output belongs to the listener protocol. The real descriptor is
 * captured first and {@link System#out} is pointed at standard error, so
 * nothing else can write protocol bytes.</p>
 */
public final class SupervisorBridgeMain {
    private static final Logger log = LoggerFactory.getLogger(SupervisorBridgeMain.class);

    /** Configuration could not be loaded or is invalid. */
    public static final int EXIT_CONFIG_ERROR = 4;

    private SupervisorBridgeMain() {
    }

    public static void main(String[] args) {
        OutputStream protocolOut = new FileOutputStream(FileDescriptor.out);
        System.setOut(System.err);

        BridgeConfig config;
        try {
            config = BridgeConfigLoader.load(args.length > 0 ? args[0] : null);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Cannot start: {}", e.getMessage());
            System.exit(EXIT_CONFIG_ERROR);
            return;
        }

        SupervisorBridgeRuntime runtime;
        try {
            runtime = SupervisorBridgeRuntime.builder()
                    .withConfig(config)
                    .withInput(new FileInputStream(FileDescriptor.in))
                    .withOutput(protocolOut)
                    .build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            // e.g. a unix:// endpoint on a host without the native epoll transport
            log.error("Cannot start: {}", e.getMessage());
            System.exit(EXIT_CONFIG_ERROR);
            return;
        }
        runtime.installShutdownHook();

        int status;
        try {
            status = runtime.run();
        } finally {
            runtime.close();
        }
        log.info("Exiting with status {}", status);
        System.exit(status);
    }
}
