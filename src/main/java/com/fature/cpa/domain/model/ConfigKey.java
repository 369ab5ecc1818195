package com.fature.cpa.domain.model;

/**
 * Hierarchical configuration identifier, e.g. cpa.validacao.opcao1.deposito_minimo
 */
public record ConfigKey(String value) {

    private static final String PREFIX = "cpa.validacao";

    public ConfigKey {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Configuration key must not be blank");
        }
    }

    public static ConfigKey minimumDeposit(ValidationOption option) {
        return scoped(option, "deposito_minimo");
    }

    public static ConfigKey minimumBets(ValidationOption option) {
        return scoped(option, "numero_apostas");
    }

    public static ConfigKey minimumGgr(ValidationOption option) {
        return scoped(option, "ggr_minimo");
    }

    public static ConfigKey eligibilityWindowDays() {
        return new ConfigKey(PREFIX + ".prazo_dias");
    }

    public static ConfigKey timezone() {
        return new ConfigKey(PREFIX + ".timezone");
    }

    public static ConfigKey fraudDetectionEnabled() {
        return new ConfigKey(PREFIX + ".deteccao_fraude_ativa");
    }

    private static ConfigKey scoped(ValidationOption option, String name) {
        return new ConfigKey(PREFIX + "." + option.getValue() + "." + name);
    }

    @Override
    public String toString() {
        return value;
    }
}
