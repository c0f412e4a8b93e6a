package org.foxesworld.aurora.engine.game;

/** Title and platform of an installation. */
public enum GameVariant {
    K1(1, Platform.DESKTOP),
    K2(2, Platform.DESKTOP),
    K1_XBOX(1, Platform.CONSOLE),
    K2_XBOX(2, Platform.CONSOLE),
    K1_IOS(1, Platform.MOBILE),
    K2_IOS(2, Platform.MOBILE),
    K1_ANDROID(1, Platform.MOBILE),
    K2_ANDROID(2, Platform.MOBILE);

    public enum Platform { DESKTOP, CONSOLE, MOBILE }

    private final int title;
    private final Platform platform;

    GameVariant(int title, Platform platform) {
        this.title = title;
        this.platform = platform;
    }

    public int title() { return title; }

    public Platform platform() { return platform; }

    public boolean isK1() { return title == 1; }

    public boolean isK2() { return title == 2; }

    public boolean isDesktop() { return platform == Platform.DESKTOP; }

    public boolean isConsole() { return platform == Platform.CONSOLE; }

    public boolean isMobile() { return platform == Platform.MOBILE; }
}
