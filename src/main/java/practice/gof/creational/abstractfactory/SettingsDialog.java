package practice.gof.creational.abstractfactory;

import java.util.List;

// client: only knows the abstract factory and product interfaces
final class SettingsDialog {
  private final Button saveButton;
  private final Checkbox notificationCheckbox;

  SettingsDialog(WidgetFactory factory) {
    this.saveButton = factory.createButton();
    this.notificationCheckbox = factory.createCheckbox();
  }

  List<String> render(boolean notificationsEnabled) {
    return List.of(
        notificationCheckbox.render("Enable notifications", notificationsEnabled),
        saveButton.render("Save"));
  }
}
