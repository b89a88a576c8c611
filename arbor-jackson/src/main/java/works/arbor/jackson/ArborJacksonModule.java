package works.arbor.jackson;

import tools.jackson.core.Version;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.module.SimpleDeserializers;
import tools.jackson.databind.module.SimpleSerializers;
import works.arbor.SerializedRecord;

/**
 * Teaches Jackson the {@link RecordJsonCodec} wire format for {@link SerializedRecord}.
 * Register it directly, or use {@link RecordJsonCodec#mapper()}.
 */
public final class ArborJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return "arbor";
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		SimpleSerializers serializers = new SimpleSerializers();
		serializers.addSerializer(SerializedRecord.class, RecordJsonCodec.recordSerializer());
		context.addSerializers(serializers);

		SimpleDeserializers deserializers = new SimpleDeserializers();
		deserializers.addDeserializer(SerializedRecord.class, RecordJsonCodec.recordDeserializer());
		context.addDeserializers(deserializers);
	}

}
