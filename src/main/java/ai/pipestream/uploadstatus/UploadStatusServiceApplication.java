package ai.pipestream.uploadstatus;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Main entry point for the Upload Status Service.
 * Issues pre-signed upload credentials and reconciles storage notifications into upload records.
 */
@QuarkusMain
@ApplicationScoped
public class UploadStatusServiceApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(UploadStatusServiceApplication.class);

    public static void main(String... args) {
        Quarkus.run(UploadStatusServiceApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Upload Status Service started, consuming storage notifications");
        Quarkus.waitForExit();
        return 0;
    }
}
