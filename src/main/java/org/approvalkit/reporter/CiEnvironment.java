package org.approvalkit.reporter;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects continuous-integration builds, where no interactive tool may be launched.
 */
public final class CiEnvironment {
    private static final List<String> CI_VARIABLES = List.of(
            "CI",
            "CONTINUOUS_INTEGRATION",
            "GITHUB_ACTIONS",
            "GITLAB_CI",
            "TF_BUILD",
            "JENKINS_URL",
            "TRAVIS",
            "TEAMCITY_VERSION",
            "BUILDKITE",
            "CIRCLECI",
            "APPVEYOR",
            "GO_SERVER_URL",
            "BITBUCKET_BUILD_NUMBER");

    private final Map<String, String> environment;

    public CiEnvironment(final Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    public static CiEnvironment system() {
        return new CiEnvironment(System.getenv());
    }

    public boolean isCi() {
        for (final String variable : CI_VARIABLES) {
            final String value = environment.get(variable);
            if (value != null && !value.isBlank() && !"false".equalsIgnoreCase(value.trim())) {
                return true;
            }
        }
        return false;
    }
}
