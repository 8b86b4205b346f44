package product.sorter.bench;

import java.util.Random;

/**
 * Product name vocabulary for generated source files.
 */
public class NamePool {

    private static final String[] ADJECTIVE = {
        "Red","Blue","Green","Silver","Golden","Compact","Deluxe","Classic","Smart","Portable",
        "Wireless","Heavy","Light","Mini","Mega","Eco","Vintage","Modern","Rustic","Ultra",
        "Quiet","Rapid","Solar","Steel","Wooden","Glass","Cotton","Leather","Bamboo","Carbon"
    };
    private static final String[] NOUN = {
        "Widget","Gadget","Lamp","Chair","Table","Kettle","Blender","Speaker","Backpack","Bottle",
        "Notebook","Pencil","Monitor","Keyboard","Mouse","Charger","Cable","Drill","Hammer","Wrench",
        "Jacket","Sneaker","Watch","Wallet","Mug","Plate","Pan","Knife","Toaster","Heater"
    };

    private final Random rnd;

    public NamePool(Random rnd) {
        this.rnd = rnd;
    }

    public String randomName() {
        return ADJECTIVE[rnd.nextInt(ADJECTIVE.length)] + " " + NOUN[rnd.nextInt(NOUN.length)];
    }
}
