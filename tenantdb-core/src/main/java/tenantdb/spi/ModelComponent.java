package tenantdb.spi;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Model registry collaborator. Definitions and models are opaque to the orchestration layer.
 */
public interface ModelComponent extends LifecycleComponent {

  /**
   * Registers models from their definitions.
   *
   * @return names of the registered models
   */
  List<String> registerModels(Handle handle, Map<String, Object> definitions);

  /**
   * Removes every registered model.
   *
   * @return number of models removed
   */
  int clearModels();

  Set<String> modelNames();

  Optional<Object> model(String name);

  default boolean hasModel(String name) {
    return modelNames().contains(name);
  }
}
