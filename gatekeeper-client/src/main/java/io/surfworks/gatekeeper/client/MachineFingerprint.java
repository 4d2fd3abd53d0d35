package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.security.Hashes;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Stable machine id for binding a license to an installation.
 *
 * <p>Uses hardware identifiers that survive reboots but change when the
 * installation moves to a different machine.
 */
public final class MachineFingerprint {

    private static final Logger LOG = Logger.getLogger(MachineFingerprint.class.getName());

    private MachineFingerprint() {}

    /**
     * Machine id for this host, computed once per process.
     *
     * <p>Components (platform-dependent):
     * <ul>
     *   <li>macOS: IOPlatformSerialNumber (hardware serial)</li>
     *   <li>Linux: /etc/machine-id + /sys/class/dmi/id/product_uuid</li>
     *   <li>otherwise, or when those are unavailable: first non-loopback MAC
     *       address, then user name and home directory</li>
     * </ul>
     *
     * @return SHA-256 of the identifiers, first 32 hex chars
     */
    public static String generate() {
        return Holder.MACHINE_ID;
    }

    /**
     * Normalized operating system name reported with validations.
     */
    public static String platform() {
        String os = osName();
        if (os.contains("mac") || os.contains("darwin")) {
            return "darwin";
        } else if (os.contains("linux")) {
            return "linux";
        } else if (os.contains("windows")) {
            return "windows";
        }
        return os.isBlank() ? "unknown" : os.replace(' ', '_');
    }

    public static String arch() {
        return System.getProperty("os.arch", "unknown").toLowerCase(Locale.ROOT);
    }

    /**
     * Short, human-readable machine name for status output.
     */
    public static String getMachineName() {
        String hostname = getHostname();
        String os = System.getProperty("os.name", "Unknown");

        if (osName().contains("mac")) {
            return hostname + " (macOS)";
        } else if (osName().contains("linux")) {
            return hostname + " (Linux)";
        } else {
            return hostname + " (" + os + ")";
        }
    }

    static String compute() {
        String os = osName();

        String rawIdentifier;
        if (os.contains("mac")) {
            rawIdentifier = getMacSerialNumber();
        } else if (os.contains("linux")) {
            rawIdentifier = getLinuxMachineId();
        } else {
            rawIdentifier = getNetworkMac();
        }

        return Hashes.sha256Hex(rawIdentifier).substring(0, 32);
    }

    private static String getMacSerialNumber() {
        try {
            Process p = new ProcessBuilder("ioreg", "-rd1", "-c", "IOPlatformExpertDevice")
                .redirectErrorStream(true)
                .start();

            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.contains("IOPlatformSerialNumber")) {
                        int start = line.indexOf("\"", line.indexOf("=")) + 1;
                        int end = line.lastIndexOf("\"");
                        if (start > 0 && end > start) {
                            return line.substring(start, end);
                        }
                    }
                }
            } finally {
                p.destroy();
            }
        } catch (IOException e) {
            LOG.fine("ioreg unavailable: " + e.getMessage());
        }

        return getNetworkMac();
    }

    private static String getLinuxMachineId() {
        StringBuilder id = new StringBuilder();
        appendFile(id, Path.of("/etc/machine-id"));
        // Readable only by root on many systems
        appendFile(id, Path.of("/sys/class/dmi/id/product_uuid"));

        if (id.length() == 0) {
            return getNetworkMac();
        }
        return id.toString();
    }

    private static void appendFile(StringBuilder id, Path path) {
        if (!Files.isReadable(path)) {
            return;
        }
        try {
            id.append(Files.readString(path).trim());
        } catch (IOException e) {
            LOG.fine("Cannot read " + path + ": " + e.getMessage());
        }
    }

    private static String getNetworkMac() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface ni = interfaces.nextElement();
                byte[] mac = ni.getHardwareAddress();
                if (mac != null && mac.length > 0 && !ni.isLoopback()) {
                    return HexFormat.of().formatHex(mac);
                }
            }
        } catch (IOException e) {
            LOG.fine("Cannot enumerate network interfaces: " + e.getMessage());
        }
        // Not hardware-bound, but stable for the account
        return System.getProperty("user.name", "unknown") + System.getProperty("user.home", "/unknown");
    }

    private static String getHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            return "unknown";
        }
    }

    private static String osName() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    }

    private static final class Holder {
        static final String MACHINE_ID = compute();
    }
}
