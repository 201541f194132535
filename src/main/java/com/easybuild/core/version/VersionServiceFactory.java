package com.easybuild.core.version;

import com.easybuild.core.model.ProjectType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the {@link VersionService} for a project's ecosystem.
 */
@Component
public class VersionServiceFactory {

    private final FlutterVersionService flutter;
    private final DotNetMauiVersionService dotNetMaui;
    private final XamarinVersionService xamarin;

    public VersionServiceFactory(FlutterVersionService flutter,
                                 DotNetMauiVersionService dotNetMaui,
                                 XamarinVersionService xamarin) {
        this.flutter = flutter;
        this.dotNetMaui = dotNetMaui;
        this.xamarin = xamarin;
    }

    /**
     * Returns the strategy for {@code type}, or empty when the type is not supported.
     */
    public Optional<VersionService> forType(ProjectType type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.of(switch (type) {
            case FLUTTER -> flutter;
            case DOTNET_MAUI -> dotNetMaui;
            case XAMARIN -> xamarin;
        });
    }

    public List<ProjectType> supportedTypes() {
        return List.of(ProjectType.FLUTTER, ProjectType.XAMARIN, ProjectType.DOTNET_MAUI);
    }
}
