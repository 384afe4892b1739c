/// Module for the Simple PST Store library that builds and parses OST/PST container images.
module com.github.simbo1905.pst {
    requires java.logging;
    requires static lombok;
    exports com.github.simbo1905.pst;
    exports com.github.simbo1905.pst.scan;
}
