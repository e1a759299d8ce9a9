package com.belgraph.compiler.config;

import com.belgraph.compiler.normalize.MalformedModifierPolicy;
import com.belgraph.compiler.normalize.MalformedModifierPolicy.Action;
import com.belgraph.compiler.normalize.MalformedModifierPolicy.Modifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
public class CompilerConfig {

    @Bean
    public CompilerSettings compilerSettings(
            @Value("${bel.compiler.required-document-keys:}") String requiredDocumentKeys,
            @Value("${bel.compiler.strict-namespaces:false}") boolean strictNamespaces,
            @Value("${bel.compiler.strict-annotations:false}") boolean strictAnnotations,
            @Value("${bel.compiler.require-evidence:false}") boolean requireEvidence,
            @Value("${bel.compiler.complete-origin:false}") boolean completeOrigin,
            @Value("${bel.compiler.malformed-modifier-policy.pmod:ERROR}") Action pmod,
            @Value("${bel.compiler.malformed-modifier-policy.substitution:ERROR}") Action substitution,
            @Value("${bel.compiler.malformed-modifier-policy.truncation:ERROR}") Action truncation,
            @Value("${bel.compiler.malformed-modifier-policy.fragment:ERROR}") Action fragment,
            @Value("${bel.compiler.malformed-modifier-policy.activity:ERROR}") Action activity) {
        Map<Modifier, Action> actions = new EnumMap<>(Modifier.class);
        actions.put(Modifier.PMOD, pmod);
        actions.put(Modifier.SUBSTITUTION, substitution);
        actions.put(Modifier.TRUNCATION, truncation);
        actions.put(Modifier.FRAGMENT, fragment);
        actions.put(Modifier.ACTIVITY, activity);

        List<String> keys = Arrays.stream(requiredDocumentKeys.split(","))
                .map(String::strip)
                .filter(k -> !k.isEmpty())
                .toList();
        return new CompilerSettings(keys, strictNamespaces, strictAnnotations, requireEvidence, completeOrigin,
                new MalformedModifierPolicy(actions));
    }
}
