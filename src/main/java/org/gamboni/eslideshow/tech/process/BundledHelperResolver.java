package org.gamboni.eslideshow.tech.process;

import com.google.common.collect.ImmutableList;
import lombok.RequiredArgsConstructor;

import java.io.File;
import java.util.Optional;

/** Looks for the helper either as a macOS application bundle or as a plain executable
 * inside the application directory.
 */
@RequiredArgsConstructor
public class BundledHelperResolver implements HelperResolver {
    private final File bundleDir;

    @Override
    public Optional<File> resolve(String helperName) {
        return ImmutableList.of(
                        new File(bundleDir, helperName + ".app/Contents/MacOS/" + helperName),
                        new File(bundleDir, helperName))
                .stream()
                .filter(File::isFile)
                .filter(File::canExecute)
                .findFirst();
    }
}
