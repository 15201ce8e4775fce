package org.netkat.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.netkat.common.util.NetKatObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>Settings shared by every verification run: where reproduction programs
 * are written, whether programs carry diagnostic comments, and how the Z3
 * solver is configured.</p>
 *
 * <p>Settings are read from JSON. Missing keys keep their default value.</p>
 */
public class VerifierSettings {

    public static final String DEFAULT_RESOURCE = "netkat-settings.json";

    private static final String ANNOTATE_VAR = "annotate";

    private static final String DEBUG_DIRECTORY_VAR = "debugDirectory";

    private static final String DEBUG_SOLVER_VAR = "debugSolver";

    private static final String TACTICS_VAR = "tactics";

    private final boolean _annotate;

    private final String _debugDirectory;

    private final boolean _debugSolver;

    private final List<String> _tactics;

    public VerifierSettings() {
        this(null, null, null, null);
    }

    @JsonCreator
    public VerifierSettings(
            @JsonProperty(ANNOTATE_VAR) Boolean annotate,
            @JsonProperty(DEBUG_DIRECTORY_VAR) String debugDirectory,
            @JsonProperty(DEBUG_SOLVER_VAR) Boolean debugSolver,
            @JsonProperty(TACTICS_VAR) List<String> tactics) {
        _annotate = (annotate == null ? true : annotate);
        _debugDirectory = (debugDirectory == null ? System.getProperty("java.io.tmpdir") :
                debugDirectory);
        _debugSolver = (debugSolver == null ? false : debugSolver);
        _tactics = (tactics == null ? Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<>(tactics)));
    }

    /**
     * Read settings from a JSON file.
     * @param file  The settings file
     * @return The parsed settings
     */
    public static VerifierSettings load(Path file) {
        try {
            return new NetKatObjectMapper().readValue(file.toFile(), VerifierSettings.class);
        } catch (IOException e) {
            throw new NetKatException("Could not read settings from " + file, e);
        }
    }

    /**
     * Read settings from the {@value #DEFAULT_RESOURCE} classpath resource,
     * falling back to the defaults when the resource does not exist.
     */
    public static VerifierSettings fromClasspath() {
        ClassLoader loader = VerifierSettings.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return new VerifierSettings();
            }
            return new NetKatObjectMapper().readValue(in, VerifierSettings.class);
        } catch (IOException e) {
            throw new NetKatException("Could not read settings resource " + DEFAULT_RESOURCE, e);
        }
    }

    @JsonProperty(ANNOTATE_VAR)
    public boolean getAnnotate() {
        return _annotate;
    }

    @JsonProperty(DEBUG_DIRECTORY_VAR)
    public String getDebugDirectory() {
        return _debugDirectory;
    }

    @JsonIgnore
    public Path getDebugPath() {
        return Paths.get(_debugDirectory);
    }

    @JsonProperty(DEBUG_SOLVER_VAR)
    public boolean getDebugSolver() {
        return _debugSolver;
    }

    @JsonProperty(TACTICS_VAR)
    public List<String> getTactics() {
        return _tactics;
    }

    /**
     * Copy of these settings writing reproduction programs to another directory.
     */
    public VerifierSettings withDebugDirectory(String debugDirectory) {
        return new VerifierSettings(_annotate, debugDirectory, _debugSolver, _tactics);
    }

}
