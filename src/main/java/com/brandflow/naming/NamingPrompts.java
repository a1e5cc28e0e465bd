package com.brandflow.naming;

final class NamingPrompts {

    private NamingPrompts() {
    }

    static final String PURPOSE_NAMES = "name-suggestions";
    static final String PURPOSE_NAMES_RETRY = "name-suggestions-retry";

    static final String SYSTEM_PROMPT = """
            You are a naming consultant for small and medium businesses in Korea.
            Suggest short, memorable business names that read well on a storefront sign.
            Return only JSON of the form {"names":[{"name":"...","description":"..."}]}.
            """;

    static final String USER_TEMPLATE = """
            Industry: {industry}
            Region: {region}
            Business size: {size}
            Description: {description}
            Market analysis: {analysis}

            Suggest exactly {count} names.
            Never suggest any of these names: {forbidden}
            """;

    static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";
}
