package cli;

import app.MapperFormatCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Option parsing, orchestration and reporting live in {@link MapperFormatCliApp};
 * this class only keeps a stable main class for run scripts.</p>
 */
public class MapperFormatCli {

    public static void main(String[] args) {
        MapperFormatCliApp.main(args);
    }
}
