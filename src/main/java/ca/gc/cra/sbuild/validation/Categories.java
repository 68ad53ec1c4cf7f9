package ca.gc.cra.sbuild.validation;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Closed category vocabulary accepted by the {@code category} field.
 *
 * <p>Registered freedesktop.org main and additional categories plus the {@code CLI} and {@code TUI}
 * categories used for console packages. Matching ignores case.</p>
 */
public final class Categories {
  private static final Set<String> KNOWN = normalize(Set.of(
      // main categories
      "AudioVideo", "Audio", "Video", "Development", "Education", "Game", "Graphics", "Network",
      "Office", "Science", "Settings", "System", "Utility",
      // additional categories
      "Building", "Debugger", "IDE", "GUIDesigner", "Profiling", "RevisionControl", "Translation",
      "Calendar", "ContactManagement", "Database", "Dictionary", "Chart", "Email", "Finance",
      "FlowChart", "PDA", "ProjectManagement", "Presentation", "Spreadsheet", "WordProcessor",
      "2DGraphics", "VectorGraphics", "RasterGraphics", "3DGraphics", "Scanning", "OCR",
      "Photography", "Publishing", "Viewer", "TextTools", "DesktopSettings", "HardwareSettings",
      "Printing", "PackageManager", "Dialup", "InstantMessaging", "Chat", "IRCClient", "Feed",
      "FileTransfer", "HamRadio", "News", "P2P", "RemoteAccess", "Telephony", "TelephonyTools",
      "VideoConference", "WebBrowser", "WebDevelopment", "Midi", "Mixer", "Sequencer", "Tuner", "TV",
      "AudioVideoEditing", "Player", "Recorder", "DiscBurning", "ActionGame", "AdventureGame",
      "ArcadeGame", "BoardGame", "BlocksGame", "CardGame", "KidsGame", "LogicGame", "RolePlaying",
      "Shooter", "Simulation", "SportsGame", "StrategyGame", "Art", "Construction", "Music",
      "Languages", "ArtificialIntelligence", "Astronomy", "Biology", "Chemistry", "ComputerScience",
      "DataVisualization", "Economy", "Electricity", "Geography", "Geology", "Geoscience", "History",
      "Humanities", "ImageProcessing", "Literature", "Maps", "Math", "NumericalAnalysis",
      "MedicalSoftware", "Physics", "Robotics", "Spirituality", "Sports", "ParallelComputing",
      "Amusement", "Archiving", "Compression", "Electronics", "Emulator", "Engineering", "FileTools",
      "FileManager", "TerminalEmulator", "Filesystem", "Monitor", "Security", "Accessibility",
      "Calculator", "Clock", "TextEditor", "Documentation", "Adult", "Core", "KDE", "GNOME", "XFCE",
      "DDE", "GTK", "Qt", "Motif", "Java", "ConsoleOnly",
      // console packages
      "CLI", "TUI"));

  private Categories() {
    // Utility
  }

  /**
   * Checks membership in the category vocabulary.
   *
   * @param category candidate category
   * @return {@code true} when the category is known
   */
  public static boolean isKnown(String category) {
    return category != null && KNOWN.contains(category.trim().toLowerCase(Locale.ROOT));
  }

  private static Set<String> normalize(Set<String> names) {
    Set<String> normalized = new TreeSet<>();
    for (String name : names) {
      normalized.add(name.toLowerCase(Locale.ROOT));
    }
    return Set.copyOf(normalized);
  }
}
