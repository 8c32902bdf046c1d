package dev.uimigrator.model;

/**
 * Well-known XML namespace URIs of the source and target dialects.
 */
public final class XamlNamespaces {

    public static final String WPF_PRESENTATION = "http://schemas.microsoft.com/winfx/2006/xaml/presentation";
    public static final String XAML = "http://schemas.microsoft.com/winfx/2006/xaml";
    public static final String AVALONIA = "https://github.com/avaloniaui";
    public static final String MARKUP_COMPATIBILITY = "http://schemas.openxmlformats.org/markup-compatibility/2006";
    public static final String BLEND_DESIGN = "http://schemas.microsoft.com/expression/blend/2008";
    public static final String CLR_NAMESPACE_PREFIX = "clr-namespace:";

    private XamlNamespaces() {
    }

    public static boolean isClrNamespace(String uri) {
        return uri != null && uri.startsWith(CLR_NAMESPACE_PREFIX);
    }

    /**
     * CLR namespace of a {@code clr-namespace:Foo.Bar;assembly=Baz} URI, {@code Foo.Bar}.
     */
    public static String clrNamespaceOf(String uri) {
        String remainder = uri.substring(CLR_NAMESPACE_PREFIX.length());
        int separator = remainder.indexOf(';');
        return separator >= 0 ? remainder.substring(0, separator) : remainder;
    }
}
