package com.autobot.mirror.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Branch mirror config. Binds {@code autobot.mirror.*}.
 */
@ConfigurationProperties(prefix = "autobot.mirror")
@NoArgsConstructor
@Getter
@Setter
public class MirrorProperties {

    /** Remote whose branches are mirrored (SSH or HTTPS URL understood by git). */
    private String repositoryUrl = "git@github.com:EdgeApp/edge-tester.git";

    /** A branch is mirrored when its name ends with one of these. */
    private List<String> branchSuffixes = new ArrayList<>(List.of("/ios", "/android"));

    /** Appended to a branch name to form its mirror ref. */
    private String mirrorSuffix = "-mirror";

    /** Pause between successive mirror operations, giving the downstream test runner time to pick each one up. */
    private Duration pauseBetweenMirrors = Duration.ofMinutes(10);

    private Duration gitCommandTimeout = Duration.ofMinutes(5);

    public void setBranchSuffixes(List<String> branchSuffixes) {
        this.branchSuffixes = branchSuffixes != null ? branchSuffixes : new ArrayList<>();
    }
}
