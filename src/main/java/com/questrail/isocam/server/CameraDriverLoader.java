package com.questrail.isocam.server;

import com.questrail.isocam.api.CameraDriverProvider;
import com.questrail.isocam.api.DriverException;
import com.questrail.isocam.sim.SimulatedCameraDriverProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves the worker's {@code driver_bin_path} argument to a
 * {@link CameraDriverProvider}.
 *
 * <ul>
 *   <li>{@value #SIMULATED} selects the built-in simulator.</li>
 *   <li>Anything else must be a directory of jars; they are put on a child
 *       class loader and searched with {@link ServiceLoader}. The first
 *       provider found is used.</li>
 * </ul>
 */
public final class CameraDriverLoader
{
    private static final Logger log = LoggerFactory.getLogger(CameraDriverLoader.class);

    public static final String SIMULATED = "simulated";

    public CameraDriverProvider load(String driverBinPath) throws DriverException {
        if (SIMULATED.equals(driverBinPath)) {
            log.info("Using the simulated camera driver");
            return new SimulatedCameraDriverProvider();
        }

        Path dir = Paths.get(driverBinPath);
        if (!Files.isDirectory(dir)) {
            throw new DriverException("Camera driver directory does not exist: " + dir.toAbsolutePath());
        }

        ClassLoader loader = new URLClassLoader(jarUrls(dir).toArray(new URL[0]),
                CameraDriverLoader.class.getClassLoader());
        try {
            Iterator<CameraDriverProvider> providers =
                    ServiceLoader.load(CameraDriverProvider.class, loader).iterator();
            if (!providers.hasNext()) {
                throw new DriverException("No " + CameraDriverProvider.class.getSimpleName() + " found in " + dir);
            }

            CameraDriverProvider provider = providers.next();
            log.info("Using camera driver {} from {}", provider.name(), dir);
            return provider;
        }
        catch (ServiceConfigurationError e) {
            throw new DriverException("Cannot load camera driver from " + dir, e);
        }
    }

    private static List<URL> jarUrls(Path dir) throws DriverException {
        List<Path> jars;
        try (Stream<Path> files = Files.list(dir)) {
            jars = files.filter(p -> p.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        catch (IOException e) {
            throw new DriverException("Cannot list camera driver directory " + dir, e);
        }

        List<URL> urls = new ArrayList<>(jars.size());
        for (Path jar : jars) {
            try {
                urls.add(jar.toUri().toURL());
            }
            catch (MalformedURLException e) {
                throw new DriverException("Bad camera driver jar path " + jar, e);
            }
        }
        log.debug("Camera driver class path: {}", urls);
        return urls;
    }
}
