package spark;

import com.google.template.soy.SoyFileSet;
import com.google.template.soy.tofu.SoyTofu;

/**
 * Accessing this class loads the Soy Tofu libraries and compiles the runtime template. This is
 * relegated to its own class so that the template is compiled once, on first use.
 */
public class RuntimeTemplateHolder {
  private static final SoyTofu TOFU =
      SoyFileSet.builder()
          .add(RuntimeTemplateHolder.class.getResource("runtime.soy"))
          .build()
          .compileToTofu();

  public static SoyTofu tofu() {
    return TOFU;
  }
}
