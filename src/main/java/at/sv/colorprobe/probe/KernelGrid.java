package at.sv.colorprobe.probe;

/**
 * Places the pixels of a kernel, in row-major order, around a normalized center position. One pixel step equals one
 * pixel of the probed image.
 */
record KernelGrid(KernelShape kernel, double stepX, double stepY, double centerX, double centerY) {

    static KernelGrid create(KernelShape kernel, int imageWidth, int imageHeight, double centerX, double centerY) {
        return new KernelGrid(kernel, 1.0 / imageWidth, 1.0 / imageHeight, centerX, centerY);
    }

    int row(int index) {
        return index / kernel.width();
    }

    int column(int index) {
        return index % kernel.width();
    }

    double x(int index) {
        double centerOffset = (kernel.width() - 1) / 2.0;
        return centerX + (column(index) - centerOffset) * stepX;
    }

    double y(int index) {
        double centerOffset = (kernel.height() - 1) / 2.0;
        return centerY + (row(index) - centerOffset) * stepY;
    }

    String identifier(int index) {
        return "k" + index + "_r" + row(index) + "_c" + column(index);
    }
}
