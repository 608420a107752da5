package com.questrail.isocam.protocol.codec;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * {@link TextCodec} backed by SnakeYAML.
 *
 * <p>Documents are written in flow style on a single line. Loading goes
 * through {@link SafeConstructor}, so only standard YAML tags are accepted.
 * {@link Yaml} instances are not thread-safe; one is created per call.</p>
 */
public final class YamlTextCodec implements TextCodec
{
    private final int maxTextLength;

    public YamlTextCodec() {
        this(WireFraming.DEFAULT_MAX_FRAME_SIZE);
    }

    public YamlTextCodec(int maxTextLength) {
        if (maxTextLength <= 0) {
            throw new IllegalArgumentException("maxTextLength must be > 0");
        }
        this.maxTextLength = maxTextLength;
    }

    @Override
    public String encode(Object value) {
        try {
            return newYaml().dump(value);
        }
        catch (YAMLException e) {
            throw new ProtocolException("Cannot encode value of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    @Override
    public Object decode(String text) {
        try {
            return newYaml().load(text);
        }
        catch (YAMLException e) {
            throw new ProtocolException("Undecodable message text: " + e.getMessage(), e);
        }
    }

    private Yaml newYaml() {
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.FLOW);
        dumperOptions.setSplitLines(false);
        dumperOptions.setWidth(Integer.MAX_VALUE);

        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setCodePointLimit(maxTextLength);
        loaderOptions.setAllowDuplicateKeys(false);

        return new Yaml(new SafeConstructor(loaderOptions),
                new Representer(dumperOptions),
                dumperOptions,
                loaderOptions);
    }
}
