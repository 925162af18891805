package org.gamboni.eslideshow.tech.process;

import java.io.File;
import java.util.Optional;

/** Locates the player helper executable shipped with the application. */
public interface HelperResolver {
    Optional<File> resolve(String helperName);
}
