package org.gamboni.eslideshow.tech.process;

/** How the internal player process is launched. */
public enum LaunchMode {
    /** Run the player from a local checkout of its repository ({@code npm run dev}). */
    DEV,
    /** Run the helper executable shipped with the application. */
    PACKAGED
}
