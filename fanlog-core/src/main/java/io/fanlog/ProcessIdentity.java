package io.fanlog;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Application, host and user names attached to every log entry.
 *
 * <p>{@link #current()} resolves the values once per process; later calls return the same
 * instance.
 *
 * @param appName     application name, derived from the launch command
 * @param machineName local host name
 * @param userName    operating-system user running the process
 */
public record ProcessIdentity(String appName, String machineName, String userName) {

    public ProcessIdentity {
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(machineName, "machineName");
        Objects.requireNonNull(userName, "userName");
    }

    public static ProcessIdentity current() {
        return Holder.CURRENT;
    }

    static String appNameFrom(String command) {
        if (command == null || command.isBlank()) {
            return "java";
        }
        String main = command.trim().split("\\s+")[0];
        if (main.endsWith(".jar")) {
            String fileName = Path.of(main).getFileName().toString();
            return fileName.substring(0, fileName.length() - ".jar".length());
        }
        int dot = main.lastIndexOf('.');
        return dot >= 0 ? main.substring(dot + 1) : main;
    }

    private static String resolveMachineName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            if (fromEnv == null) {
                fromEnv = System.getenv("COMPUTERNAME");
            }
            return fromEnv != null ? fromEnv : "localhost";
        }
    }

    private static final class Holder {
        static final ProcessIdentity CURRENT = new ProcessIdentity(
                appNameFrom(System.getProperty("sun.java.command")),
                resolveMachineName(),
                System.getProperty("user.name", ""));
    }
}
