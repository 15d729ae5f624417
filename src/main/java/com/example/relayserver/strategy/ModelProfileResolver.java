package com.example.relayserver.strategy;

import com.example.relayserver.exception.UnknownModelException;
import com.example.relayserver.model.ModelResolution;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 继电器型号解析
 *
 * <ol>
 *   <li>内容特征：所有型号的特征正则按长度降序，第一个在内容采样中命中者</li>
 *   <li>扩展名：恰好一个型号声明该扩展名</li>
 *   <li>文件名：只在声明该扩展名的型号中按正则长度降序匹配，文件名不能单独决定型号</li>
 * </ol>
 * 都不命中时抛出 UnknownModelException，不回退到默认策略。
 */
public class ModelProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelProfileResolver.class);

    private final List<RelayModelProfile> profiles;
    private final List<PatternRule> contentRules = new ArrayList<>();

    public ModelProfileResolver(List<RelayModelProfile> profiles) {
        this.profiles = List.copyOf(profiles);
        for (RelayModelProfile profile : this.profiles) {
            for (String signature : profile.getContentSignatures()) {
                contentRules.add(new PatternRule(profile, signature));
            }
        }
        contentRules.sort(Comparator.comparingInt((PatternRule r) -> r.regex.length()).reversed());
    }

    public List<RelayModelProfile> getProfiles() {
        return profiles;
    }

    public ModelResolution resolve(SourceDocument document) throws UnknownModelException {
        String content = document.getContentSample();
        if (!content.isEmpty()) {
            for (PatternRule rule : contentRules) {
                if (rule.pattern.matcher(content).find()) {
                    return resolved(document, new ModelResolution(rule.profile, ModelResolution.Signal.CONTENT, rule.regex));
                }
            }
        }

        List<RelayModelProfile> byExtension = claimingExtension(document.getExtension());
        if (byExtension.size() == 1) {
            return resolved(document, new ModelResolution(byExtension.get(0),
                    ModelResolution.Signal.EXTENSION, document.getExtension()));
        }

        if (byExtension.size() > 1) {
            List<PatternRule> nameRules = new ArrayList<>();
            for (RelayModelProfile profile : byExtension) {
                for (String regex : profile.getFilenamePatterns()) {
                    nameRules.add(new PatternRule(profile, regex));
                }
            }
            nameRules.sort(Comparator.comparingInt((PatternRule r) -> r.regex.length()).reversed());
            for (PatternRule rule : nameRules) {
                if (rule.pattern.matcher(document.getFileName()).find()) {
                    return resolved(document, new ModelResolution(rule.profile, ModelResolution.Signal.FILENAME, rule.regex));
                }
            }
        }

        log.warn("无法识别型号: {}（扩展名 {} 的候选 {} 个）", document.getFileName(),
                document.getExtension(), byExtension.size());
        throw new UnknownModelException(document.getFileName());
    }

    private List<RelayModelProfile> claimingExtension(String extension) {
        List<RelayModelProfile> result = new ArrayList<>();
        if (extension.isEmpty()) {
            return result;
        }
        for (RelayModelProfile profile : profiles) {
            for (String ext : profile.getExtensions()) {
                if (ext.toUpperCase(Locale.ROOT).equals(extension)) {
                    result.add(profile);
                    break;
                }
            }
        }
        return result;
    }

    private static ModelResolution resolved(SourceDocument document, ModelResolution resolution) {
        log.debug("{} -> {}", document.getFileName(), resolution);
        return resolution;
    }

    private static class PatternRule {
        final RelayModelProfile profile;
        final String regex;
        final Pattern pattern;

        PatternRule(RelayModelProfile profile, String regex) {
            this.profile = profile;
            this.regex = regex;
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }
    }
}
