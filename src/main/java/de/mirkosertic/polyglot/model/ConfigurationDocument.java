package de.mirkosertic.polyglot.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the persisted configuration: alternatives with their mirrors, per-user assignments,
 * group mappings and global settings.
 */
public class ConfigurationDocument {

    private List<LanguageAlternative> languageAlternatives = new ArrayList<>();
    private List<UserLanguageConfig> userLanguages = new ArrayList<>();
    private List<GroupLanguageMapping> groupMappings = new ArrayList<>();
    private PolyglotSettings settings = new PolyglotSettings();

    public ConfigurationDocument deepCopy() {
        final ConfigurationDocument copy = new ConfigurationDocument();
        for (final LanguageAlternative alternative : languageAlternatives) {
            copy.languageAlternatives.add(alternative.deepCopy());
        }
        for (final UserLanguageConfig config : userLanguages) {
            copy.userLanguages.add(config.deepCopy());
        }
        for (final GroupLanguageMapping mapping : groupMappings) {
            copy.groupMappings.add(mapping.deepCopy());
        }
        copy.settings = settings.deepCopy();
        return copy;
    }

    public List<LanguageAlternative> getLanguageAlternatives() {
        return languageAlternatives;
    }

    public void setLanguageAlternatives(final List<LanguageAlternative> languageAlternatives) {
        this.languageAlternatives = languageAlternatives;
    }

    public List<UserLanguageConfig> getUserLanguages() {
        return userLanguages;
    }

    public void setUserLanguages(final List<UserLanguageConfig> userLanguages) {
        this.userLanguages = userLanguages;
    }

    public List<GroupLanguageMapping> getGroupMappings() {
        return groupMappings;
    }

    public void setGroupMappings(final List<GroupLanguageMapping> groupMappings) {
        this.groupMappings = groupMappings;
    }

    public PolyglotSettings getSettings() {
        return settings;
    }

    public void setSettings(final PolyglotSettings settings) {
        this.settings = settings;
    }
}
