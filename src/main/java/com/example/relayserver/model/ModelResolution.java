package com.example.relayserver.model;

/**
 * 型号解析结果：命中的配置 + 命中它的信号
 */
public class ModelResolution {

    public enum Signal {
        CONTENT,
        EXTENSION,
        FILENAME
    }

    private final RelayModelProfile profile;
    private final Signal signal;
    private final String matchedPattern;

    public ModelResolution(RelayModelProfile profile, Signal signal, String matchedPattern) {
        this.profile = profile;
        this.signal = signal;
        this.matchedPattern = matchedPattern;
    }

    public RelayModelProfile getProfile() {
        return profile;
    }

    public Signal getSignal() {
        return signal;
    }

    public String getMatchedPattern() {
        return matchedPattern;
    }

    @Override
    public String toString() {
        return profile.getModelCode() + " (by " + signal + ": " + matchedPattern + ")";
    }
}
