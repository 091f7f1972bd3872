package org.hardshell.share;

public class Constants {

    final static public String BOOTSTRAP_CONFIG_ASSET_PATH = "assets/hardshell/bootstrap.json";
    final static public String PAYLOAD_ASSET_PATH = "assets/hardshell/payload.bin";
    final static public String HARDSHELL_ASSET_DIR = "assets/hardshell/";

    final static public String STUB_APPLICATION = "org.hardshell.metaloader.ShellApplication";
    final static public String STUB_APP_COMPONENT_FACTORY = "org.hardshell.metaloader.ShellComponentFactory";
    final static public String STUB_BOOTSTRAP_PROVIDER = "org.hardshell.metaloader.ShellBootstrapProvider";
    final static public String BOOTSTRAP_PROVIDER_AUTHORITY_SUFFIX = ".hardshell.bootstrap";
    final static public int BOOTSTRAP_PROVIDER_INIT_ORDER = 1000;
    final static public String STUB_NATIVE_LIBRARY = "libhardshell.so";

    final static public String META_ORIGINAL_APPLICATION = "hardshell.original_application";
    final static public String META_ORIGINAL_FACTORY = "hardshell.original_factory";

    final static public String DEFAULT_APPLICATION = "android.app.Application";

    final static public int BOOTSTRAP_FORMAT_VERSION = 1;
}
